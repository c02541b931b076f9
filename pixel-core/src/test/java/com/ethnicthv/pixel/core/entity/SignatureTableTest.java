package com.ethnicthv.pixel.core.entity;

import com.ethnicthv.pixel.core.components.ComponentSignature;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class SignatureTableTest {

    @Test
    void capacityDoublesFromTwo() {
        SignatureTable table = new SignatureTable(2);
        assertEquals(2, table.capacity());

        table.ensureCapacity(1);
        assertEquals(2, table.capacity());

        table.ensureCapacity(2);
        assertEquals(4, table.capacity());

        table.ensureCapacity(4);
        assertEquals(8, table.capacity());

        table.ensureCapacity(20);
        assertEquals(32, table.capacity());
    }

    @Test
    void unsetAndOutOfRangeSlotsReadEmpty() {
        SignatureTable table = new SignatureTable(2);
        assertTrue(table.get(0).isEmpty());
        assertTrue(table.get(500).isEmpty());
        assertTrue(table.get(-1).isEmpty());
    }

    @Test
    void setGrowsAndResetClears() {
        SignatureTable table = new SignatureTable(2);
        ComponentSignature s = ComponentSignature.empty().set(3);

        table.set(9, s);
        assertEquals(s, table.get(9));
        assertEquals(16, table.capacity());

        table.reset(9);
        assertTrue(table.get(9).isEmpty());
    }

    @Test
    void clearEmptiesEverySlotAndKeepsCapacity() {
        SignatureTable table = new SignatureTable(2);
        table.set(0, ComponentSignature.empty().set(1));
        table.set(5, ComponentSignature.empty().set(2));

        table.clear();

        assertTrue(table.get(0).isEmpty());
        assertTrue(table.get(5).isEmpty());
        assertEquals(8, table.capacity());
    }
}
