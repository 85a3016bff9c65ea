package com.vidnyan.gae.domain.text;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class GrammarScannerTest {

    @Test
    void quotedLiterals_ShouldReturnContentsInOrder() {
        assertEquals(List.of("a", "", "b c"), GrammarScanner.quotedLiterals("x = \"a\" \"\" \"b c\""));
    }

    @Test
    void quotedLiterals_UnterminatedLiteral_ShouldEndAtLineBreak() {
        assertEquals(List.of("ok"), GrammarScanner.quotedLiterals("a = \"open\nb = \"ok\""));
    }

    @Test
    void splitAlternatives_ShouldIgnoreBarsInsideLiterals() {
        assertEquals(List.of("\"|\" a", "b", ""), GrammarScanner.splitAlternatives("\"|\" a | b |"));
    }

    @Test
    void maxNestingDepth_ShouldCountAllBracketKinds() {
        assertEquals(3, GrammarScanner.maxNestingDepth("a = ( [ { x } ] ) ( y )"));
        assertEquals(0, GrammarScanner.maxNestingDepth("a = \"(((\""));
    }

    @Test
    void maxNestingDepth_StrayClosers_ShouldNotGoNegative() {
        assertEquals(1, GrammarScanner.maxNestingDepth(")))( x )"));
    }

    @Test
    void innermostGroups_ShouldMatchLeftmostInnermostSpans() {
        assertEquals(List.of("b", "d"), GrammarScanner.innermostGroups("[a [b] c] [d]", '[', ']'));
    }

    @Test
    void identifiers_ShouldSkipLiteralsAndDigitLedRuns() {
        String text = "a = b_1 \"c\" 9x d";

        assertEquals(List.of("a", "b_1", "d"), GrammarScanner.identifiers(text, 0, text.length()));
    }

    @Test
    void indexOfDefinition_ShouldIgnoreQuotedEqualsSign() {
        assertEquals(-1, GrammarScanner.indexOfDefinition("\"=\" x"));
        assertEquals(2, GrammarScanner.indexOfDefinition("a = \"=\""));
    }
}
