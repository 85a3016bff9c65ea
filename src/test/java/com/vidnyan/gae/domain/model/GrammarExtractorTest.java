package com.vidnyan.gae.domain.model;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;
import java.util.Set;

import static com.vidnyan.gae.GrammarEngineFixtures.model;
import static org.junit.jupiter.api.Assertions.*;

class GrammarExtractorTest {

    @Test
    void extract_ShouldReturnRulesInSourceOrder() {
        GrammarModel model = model("expr = term { \"+\" term } ; term = factor ; factor = \"x\" ;");

        assertEquals(List.of("expr", "term", "factor"),
                model.rules().stream().map(Rule::name).toList());
        assertEquals("term { \"+\" term }", model.rules().get(0).body());
        assertEquals(1, model.rules().get(0).line());
        assertEquals(3, model.rules().get(2).line());
    }

    @Test
    void extract_ShouldDeriveSymbolSetsFromWholeText() {
        GrammarModel model = model("expr = term \"+\" term | \"x\" ; term = \"x\" | ident ;");

        assertEquals(Set.of("+", "x"), model.terminals());
        assertEquals(Set.of("term", "ident"), model.nonTerminals());
    }

    @Test
    void extract_DefinitionNames_ShouldNotCountAsUses() {
        GrammarModel model = model("a = \"x\" ; b = \"y\" ;");

        assertTrue(model.nonTerminals().isEmpty());
        assertEquals(Set.of("a", "b"), model.ruleNames());
    }

    @Test
    void extract_StatementWithoutDefinition_ShouldCountEveryIdentifierAsUse() {
        GrammarModel model = model("A = \"x\" ; B ; loose words \"here\" ;");

        assertEquals(Set.of("A"), model.ruleNames());
        assertEquals(Set.of("B", "loose", "words"), model.nonTerminals());
        assertTrue(model.malformedLines().isEmpty());
    }

    @Test
    void extract_UnterminatedLiteral_ShouldNotSwallowNextRule() {
        GrammarModel model = model("a = \"x ;\nb = \"y\" ;");

        assertEquals(List.of("a", "b"), model.rules().stream().map(Rule::name).toList());
        assertEquals("\"y\"", model.rules().get(1).body());
        assertEquals(Set.of("y"), model.terminals());
    }

    @Test
    void extract_ShouldKeepDuplicateDefinitions() {
        GrammarModel model = model("a = \"x\" ; a = \"y\" ;");

        assertEquals(2, model.rules().size());
        assertEquals(1, model.ruleNames().size());
    }

    @Test
    void extract_MalformedDefinitionLine_ShouldBeRecordedWithLineNumber() {
        GrammarModel model = model("a = \"x\" ; 9bad = \"y\" ; c = a ;");

        assertEquals(2, model.rules().size());
        assertEquals(1, model.malformedLines().size());
        assertEquals(2, model.malformedLines().get(0).line());
    }

    @Test
    void extract_EmptyText_ShouldHaveNoRules() {
        GrammarModel model = model("");

        assertFalse(model.hasRules());
        assertTrue(model.terminals().isEmpty());
        assertTrue(model.nonTerminals().isEmpty());
    }

    @Test
    void matchRule_ShouldRequireSomethingAfterDefinitionSign() {
        assertTrue(GrammarExtractor.matchRule("a =", 1).isEmpty());

        Optional<Rule> empty = GrammarExtractor.matchRule("a =;", 1);
        assertTrue(empty.isPresent());
        assertEquals("", empty.get().body());
    }

    @Test
    void matchRule_ShouldStripTerminator() {
        Rule rule = GrammarExtractor.matchRule("list = item { \",\" item };", 4).orElseThrow();

        assertEquals("list", rule.name());
        assertEquals("item { \",\" item }", rule.body());
        assertEquals(4, rule.line());
    }
}
