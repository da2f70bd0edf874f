package com.raditha.unnest.refactoring;

import com.raditha.unnest.model.ExtractedSubroutine;
import com.raditha.unnest.model.Span;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class TransformEngineTest {

    private static final String TEXT = "0123456789";
    private static final Span SPAN = new Span(2, 5, 1, 1);

    private static ExtractedSubroutine sub(String text, int offset) {
        return new ExtractedSubroutine("s", 1, List.of(), text, offset, false);
    }

    @Test
    void testReplacesSpan() {
        assertEquals("01X56789", TransformEngine.splice(TEXT, SPAN, "X", List.of()));
    }

    @Test
    void testInsertionsBeforeAndAfter() {
        assertEquals("P01X567S89", TransformEngine.splice(TEXT, SPAN, "X", List.of(sub("S", 8), sub("P", 0))));
    }

    @Test
    void testInsertionAtSpanStartGoesFirst() {
        assertEquals("01PX56789", TransformEngine.splice(TEXT, SPAN, "X", List.of(sub("P", 2))));
    }

    @Test
    void testEqualOffsetsKeepListOrder() {
        assertEquals("01X567AB89", TransformEngine.splice(TEXT, SPAN, "X", List.of(sub("A", 8), sub("B", 8))));
    }

    @Test
    void testInsertionInsideSpanIsRejected() {
        assertThrows(IllegalArgumentException.class,
                () -> TransformEngine.splice(TEXT, SPAN, "X", List.of(sub("S", 3))));
    }
}
