package com.ethnicthv.pixel.core.components;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class SparseSetTest {

    @Test
    void addIsIdempotentAndPacksDensely() {
        SparseSet set = new SparseSet(4);
        assertEquals(0, set.add(10));
        assertEquals(1, set.add(3));
        assertEquals(0, set.add(10));
        assertEquals(2, set.size());
        assertEquals(10, set.getEntity(0));
        assertEquals(3, set.getEntity(1));
    }

    @Test
    void removeSwapsLastIntoHole() {
        SparseSet set = new SparseSet(2);
        set.add(1);
        set.add(2);
        set.add(3);

        assertEquals(0, set.remove(1));
        assertFalse(set.has(1));
        assertEquals(2, set.size());
        assertEquals(3, set.getEntity(0));
        assertEquals(0, set.getDenseIndex(3));
        assertEquals(1, set.getDenseIndex(2));

        assertEquals(-1, set.remove(1), "removing an absent id is a no-op");
    }

    @Test
    void growsBeyondInitialCapacity() {
        SparseSet set = new SparseSet(1);
        for (int id = 0; id < 100; id += 3) {
            set.add(id);
        }
        set.add(1000);
        assertTrue(set.has(1000));
        assertTrue(set.has(99));
        assertFalse(set.has(98));
        assertFalse(set.has(5000));
        assertEquals(35, set.size());
    }

    @Test
    void outOfRangeQueries() {
        SparseSet set = new SparseSet(4);
        assertFalse(set.has(-1));
        assertEquals(-1, set.getDenseIndex(42));
        assertThrows(IndexOutOfBoundsException.class, () -> set.getEntity(0));
        assertThrows(IllegalArgumentException.class, () -> set.add(-5));
        assertThrows(IllegalArgumentException.class, () -> new SparseSet(0));
    }

    @Test
    void clearForgetsEverything() {
        SparseSet set = new SparseSet(4);
        set.add(0);
        set.add(7);
        set.clear();
        assertEquals(0, set.size());
        assertFalse(set.has(7));
        assertEquals(0, set.add(7));
    }
}
