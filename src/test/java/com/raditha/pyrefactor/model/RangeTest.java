package com.raditha.pyrefactor.model;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class RangeTest {

    @Test
    void testEnclosesIsInclusiveOnBothEnds() {
        Range outer = new Range(1, 1, 5, 10);

        assertTrue(outer.encloses(new Range(2, 4, 3, 1)));
        assertTrue(outer.encloses(outer));
        assertFalse(outer.encloses(new Range(1, 1, 5, 11)));
        assertFalse(new Range(2, 1, 3, 1).encloses(outer));
    }

    @Test
    void testLineHelpers() {
        Range range = Range.ofLines(3, 5);

        assertEquals(3, range.getLineCount());
        assertTrue(range.containsLine(5));
        assertFalse(range.containsLine(6));
        assertEquals("L3-5", range.toDisplayString());
        assertEquals("L7", Range.ofLines(7, 7).toString());
    }

    @Test
    void testInvalidRange() {
        assertThrows(IllegalArgumentException.class, () -> new Range(0, 1, 1, 1));
        assertThrows(IllegalArgumentException.class, () -> new Range(5, 1, 4, 1));
    }
}
