package org.dxworks.lexframe.citation;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class SpanSetTest {

    @Test
    void overlaps_HalfOpenIntervals() {
        SpanSet spans = new SpanSet();
        spans.add(10, 20);
        spans.add(30, 40);

        assertFalse(spans.overlaps(0, 10));
        assertFalse(spans.overlaps(20, 30));
        assertTrue(spans.overlaps(19, 21));
        assertTrue(spans.overlaps(5, 45));
        assertTrue(spans.overlaps(32, 35));
        assertEquals(2, spans.size());
    }

    @Test
    void add_RejectsOverlapAndEmptySpans() {
        SpanSet spans = new SpanSet();
        spans.add(10, 20);

        assertThrows(IllegalStateException.class, () -> spans.add(15, 25));
        assertThrows(IllegalArgumentException.class, () -> spans.add(30, 30));
        assertEquals(1, spans.size());
    }
}
