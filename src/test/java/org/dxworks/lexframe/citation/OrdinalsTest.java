package org.dxworks.lexframe.citation;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;

public class OrdinalsTest {

    @Test
    void toIndex_OneBased() {
        assertEquals(1, Ordinals.toIndex("first"));
        assertEquals(3, Ordinals.toIndex("Third"));
        assertEquals(10, Ordinals.toIndex("tenth"));
        assertNull(Ordinals.toIndex("last"));
        assertNull(Ordinals.toIndex(null));
    }

    @Test
    void toWord_InverseOfToIndex() {
        assertEquals("second", Ordinals.toWord(2));
        assertNull(Ordinals.toWord(0));
        assertNull(Ordinals.toWord(11));
    }
}
