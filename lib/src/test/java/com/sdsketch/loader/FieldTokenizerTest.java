package com.sdsketch.loader;

import static org.junit.jupiter.api.Assertions.assertEquals;

import java.util.List;
import org.junit.jupiter.api.Test;

class FieldTokenizerTest {

    @Test
    void splitsOnTopLevelCommasOnly() {
        assertEquals(
                List.of("10", "12", "\"Workload, Peak (max)\"", "800", "450"),
                FieldTokenizer.split("10,12,\"Workload, Peak (max)\",800,450"));
    }

    @Test
    void keepsPolylineInOneField() {
        List<String> fields = FieldTokenizer.split("1,22,10,9,0,0,45,22,0,0,0,-1--1--1,,1|(520,300)(600,200)|");
        assertEquals(14, fields.size());
        assertEquals("", fields.get(12));
        assertEquals("1|(520,300)(600,200)|", fields.get(13));
    }

    @Test
    void doubledQuoteIsEscapedInsideQuotes() {
        assertEquals(List.of("\"say \"\"hi\"\", then\"", "x"), FieldTokenizer.split("\"say \"\"hi\"\", then\",x"));
        assertEquals("say \"hi\", then", FieldTokenizer.unquote(" \"say \"\"hi\"\", then\" "));
    }

    @Test
    void quotesInsideParenthesesDoNotCloseTheSpan() {
        assertEquals(List.of("f(\"a)b\",c)", "d"), FieldTokenizer.split("f(\"a)b\",c),d"));
    }

    @Test
    void findsBalancedParenthesisIgnoringQuotedOnes() {
        String expression = "A FUNCTION OF( \"Rate (net)\",Stock)";
        int open = expression.indexOf('(');
        assertEquals(expression.length() - 1, FieldTokenizer.findClosingParen(expression, open));
        String unbalanced = "A FUNCTION OF( x";
        assertEquals(-1, FieldTokenizer.findClosingParen(unbalanced, unbalanced.indexOf('(')));
    }

    @Test
    void unquoteLeavesPlainNamesAlone() {
        assertEquals("Core Developer", FieldTokenizer.unquote("  Core Developer "));
        assertEquals("\"", FieldTokenizer.unquote("\""));
    }

    @Test
    void indexOfUnquotedSkipsQuotedTargets() {
        assertEquals(8, FieldTokenizer.indexOfUnquoted("\"a = b\" = c", '=', 0));
    }
}
