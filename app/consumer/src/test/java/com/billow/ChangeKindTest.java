package com.billow;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ChangeKindTest {

    @Test
    void testToString() {
        assertEquals("insert", ChangeKind.INSERT.toString());
        assertEquals("update", ChangeKind.UPDATE.toString());
        assertEquals("delete", ChangeKind.DELETE.toString());
        assertEquals("truncate", ChangeKind.TRUNCATE.toString());
        assertEquals("message", ChangeKind.MESSAGE.toString());
    }

    @Test
    void testFromString() {
        assertEquals(ChangeKind.INSERT, ChangeKind.fromString("insert"));
        assertEquals(ChangeKind.UPDATE, ChangeKind.fromString("update"));
        assertEquals(ChangeKind.DELETE, ChangeKind.fromString("delete"));
        assertEquals(ChangeKind.TRUNCATE, ChangeKind.fromString("truncate"));
    }

    @Test
    void testFromStringUnknown() {
        assertEquals(ChangeKind.OTHER, ChangeKind.fromString("begin"));
        assertEquals(ChangeKind.OTHER, ChangeKind.fromString("INSERT"));
        assertEquals(ChangeKind.OTHER, ChangeKind.fromString(null));
    }

    @Test
    void testIsRowChange() {
        assertTrue(ChangeKind.INSERT.isRowChange());
        assertTrue(ChangeKind.UPDATE.isRowChange());
        assertTrue(ChangeKind.DELETE.isRowChange());
        assertFalse(ChangeKind.TRUNCATE.isRowChange());
        assertFalse(ChangeKind.MESSAGE.isRowChange());
        assertFalse(ChangeKind.OTHER.isRowChange());
    }
}
