package org.sdmodel.mdl;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class FieldSplitterTest {

    @Test
    void splitsPlainRecord() {
        assertEquals(List.of("10", "1", "Population", "412", "232"),
                FieldSplitter.split("10,1,Population,412,232"));
    }

    @Test
    void quotedCommaDoesNotSplit() {
        assertEquals(List.of("10", "4", "Hiring, net", "180"),
                FieldSplitter.split("10,4,\"Hiring, net\",180"));
    }

    @Test
    void doubledQuoteIsLiteral() {
        assertEquals(List.of("a", "say \"hi\"", "b"),
                FieldSplitter.split("a,\"say \"\"hi\"\"\",b"));
    }

    @Test
    void emptyFieldsAreKept() {
        assertEquals(List.of("a", "", "b", ""), FieldSplitter.split("a,,b,"));
        assertTrue(FieldSplitter.split("").isEmpty());
        assertTrue(FieldSplitter.split(null).isEmpty());
    }

    @Test
    void unterminatedQuoteRunsToEndOfLine() {
        assertEquals(List.of("10", "5", "open, name"), FieldSplitter.split("10,5,\"open, name"));
    }

    @ParameterizedTest
    @ValueSource(strings = {
            "10,1,Population,412,232,40,20,3,3,0,0,0,0,0,0",
            "10,4,\"Hiring (net)\",180,320,44,11,8,3,0,0,-1,0,0,0",
            "10,9,\"a \"\"quoted\"\", name\",1,2",
            "1,14,13,6,0,0,0,0,0,64,0,-1--1--1,,1|(0,0)|",
            "",
            ",,"
    })
    void rawSegmentsRejoinToTheLine(String line) {
        assertEquals(line, String.join(",", FieldSplitter.splitRaw(line)));
    }

    @Test
    void rawSegmentsKeepQuotes() {
        List<String> raw = FieldSplitter.splitRaw("10,4,\"Hiring, net\",180");
        assertEquals(4, raw.size());
        assertEquals("\"Hiring, net\"", raw.get(2));
    }

    @Test
    void indexOfUnquotedSkipsQuotedSpans() {
        assertEquals(6, FieldSplitter.indexOfUnquoted("\"a=b\" = 3", '='));
        assertEquals(-1, FieldSplitter.indexOfUnquoted("\"a=b\"", '='));
    }

    @Test
    void unquote() {
        assertEquals("A \"B\"", FieldSplitter.unquote("  \"A \"\"B\"\"\" "));
        assertEquals("Plain", FieldSplitter.unquote(" Plain "));
    }

    @Test
    void quoteIfNeeded() {
        assertEquals("Birth Rate", FieldSplitter.quoteIfNeeded("Birth Rate"));
        assertEquals("\"Hiring (net)\"", FieldSplitter.quoteIfNeeded("Hiring (net)"));
        assertEquals("\"a, b\"", FieldSplitter.quoteIfNeeded("a, b"));
        assertEquals("\"say \"\"x\"\"\"", FieldSplitter.quoteIfNeeded("say \"x\""));
    }

    @Test
    void quotedNameSurvivesSplitting() {
        String name = "Effect of \"Peer\" Support, delayed";
        String line = "10,7," + FieldSplitter.quoteIfNeeded(name) + ",1,2,3,4,8";
        assertEquals(name, FieldSplitter.split(line).get(2));
    }
}
