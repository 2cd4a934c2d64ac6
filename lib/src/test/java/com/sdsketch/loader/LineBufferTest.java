package com.sdsketch.loader;

import static org.junit.jupiter.api.Assertions.assertEquals;

import java.util.List;
import org.junit.jupiter.api.Test;

class LineBufferTest {

    @Test
    void rendersUntouchedTextVerbatim() {
        for (String text : List.of("a\nb\n", "a\r\nb\r\n", "a\nb", "mixed\r\nend\n", "")) {
            assertEquals(text, LineBuffer.of(text).render());
        }
    }

    @Test
    void insertedLinesUseDominantTerminator() {
        LineBuffer buffer = LineBuffer.of("first\r\nlast\r\n");
        buffer.insert(1, List.of("middle"));

        assertEquals("\r\n", buffer.getNewline());
        assertEquals("first\r\nmiddle\r\nlast\r\n", buffer.render());
    }

    @Test
    void appendingKeepsMissingFinalNewline() {
        LineBuffer buffer = LineBuffer.of("a\nb");
        buffer.insert(2, List.of("c"));
        assertEquals("a\nb\nc", buffer.render());

        LineBuffer terminated = LineBuffer.of("a\n");
        terminated.insert(1, List.of("b", "c"));
        assertEquals("a\nb\nc\n", terminated.render());
    }
}
