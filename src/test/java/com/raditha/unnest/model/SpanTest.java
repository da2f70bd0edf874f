package com.raditha.unnest.model;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class SpanTest {

    @Test
    void testContainsAndOverlaps() {
        Span outer = new Span(10, 50, 2, 6);
        Span inner = new Span(20, 30, 3, 4);
        Span adjacent = new Span(50, 60, 6, 7);

        assertTrue(outer.contains(inner));
        assertFalse(inner.contains(outer));
        assertTrue(outer.overlaps(inner));
        assertFalse(outer.overlaps(adjacent), "half-open spans that touch do not overlap");
        assertEquals(40, outer.length());
    }

    @Test
    void testDisplay() {
        assertEquals("L3", new Span(0, 5, 3, 3).toDisplayString());
        assertEquals("L3-5", new Span(0, 5, 3, 5).toDisplayString());
        assertEquals(3, new Span(0, 5, 3, 5).getLineCount());
    }

    @Test
    void testInvalidSpans() {
        assertThrows(IllegalArgumentException.class, () -> new Span(5, 4, 1, 1));
        assertThrows(IllegalArgumentException.class, () -> new Span(-1, 4, 1, 1));
        assertThrows(IllegalArgumentException.class, () -> new Span(0, 4, 0, 1));
        assertThrows(IllegalArgumentException.class, () -> new Span(0, 4, 3, 2));
    }
}
