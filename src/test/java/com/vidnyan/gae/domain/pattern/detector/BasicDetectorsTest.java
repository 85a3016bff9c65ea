package com.vidnyan.gae.domain.pattern.detector;

import com.vidnyan.gae.domain.pattern.GrammarPattern;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.vidnyan.gae.GrammarEngineFixtures.model;
import static org.junit.jupiter.api.Assertions.*;

class BasicDetectorsTest {

    @Test
    void leftRecursion_ShouldListRecursiveRules() {
        GrammarPattern pattern = new LeftRecursionDetector()
                .detect(model("expr = expr \"+\" term | term ; term = term \"*\" \"x\" | \"x\" ; x = \"y\" ;"))
                .orElseThrow();

        assertEquals(2, pattern.occurrences());
        assertEquals(List.of("expr", "term"), pattern.examples());
        assertEquals(0.8, pattern.optimizationPotential());
    }

    @Test
    void rightRecursion_ShouldMatchBodiesEndingInIdentifier() {
        GrammarPattern pattern = new RightRecursionDetector()
                .detect(model("list = \"x\" list ; item = \"y\" ; pair = item \"z\" ;"))
                .orElseThrow();

        assertEquals(1, pattern.occurrences());
        assertEquals(List.of("list -> list"), pattern.examples());
    }

    @Test
    void optionalAndRepetitionGroups_ShouldReturnInnermostContents() {
        String grammar = "a = [ \"x\" ] { \"y\" } [ b ] ; b = { [ \"z\" ] } ;";

        GrammarPattern optional = new OptionalGroupDetector().detect(model(grammar)).orElseThrow();
        assertEquals(3, optional.occurrences());
        assertEquals(List.of(" \"x\" ", " b ", " \"z\" "), optional.examples());

        GrammarPattern repetition = new RepetitionGroupDetector().detect(model(grammar)).orElseThrow();
        assertEquals(2, repetition.occurrences());
    }

    @Test
    void alternation_ShouldCountEveryBar() {
        GrammarPattern pattern = new AlternationDetector()
                .detect(model("a = \"x\" | \"y\" | \"|\" ; b = a | \"z\" ; c = a ;"))
                .orElseThrow();

        assertEquals(3, pattern.occurrences());
        assertEquals(List.of("a (3 alternatives)", "b (2 alternatives)"), pattern.examples());
    }

    @Test
    void nestedGroups_ShouldMatchGroupsContainingGroups() {
        GrammarPattern pattern = new NestedGroupDetector()
                .detect(model("a = ( b ( c ) ) ( d ) ; b = \"x\" ; c = b ; d = c ;"))
                .orElseThrow();

        assertEquals(1, pattern.occurrences());
        assertEquals(List.of(" b ( c ) "), pattern.examples());
    }

    @Test
    void detectors_ShouldReturnEmptyWhenPatternIsAbsent() {
        var model = model("a = \"x\" ;");

        assertTrue(new LeftRecursionDetector().detect(model).isEmpty());
        assertTrue(new RightRecursionDetector().detect(model).isEmpty());
        assertTrue(new OptionalGroupDetector().detect(model).isEmpty());
        assertTrue(new AlternationDetector().detect(model).isEmpty());
        assertTrue(new NestedGroupDetector().detect(model).isEmpty());
    }

    @Test
    void examples_ShouldBeCappedAtFive() {
        GrammarPattern pattern = new OptionalGroupDetector()
                .detect(model("a = [ \"1\" ] [ \"2\" ] [ \"3\" ] [ \"4\" ] [ \"5\" ] [ \"6\" ] [ \"7\" ] ;"))
                .orElseThrow();

        assertEquals(7, pattern.occurrences());
        assertEquals(GrammarPattern.MAX_EXAMPLES, pattern.examples().size());
    }
}
