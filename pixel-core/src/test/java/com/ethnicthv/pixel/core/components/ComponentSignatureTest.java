package com.ethnicthv.pixel.core.components;

import com.ethnicthv.pixel.core.ComponentCapacityExceededException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class ComponentSignatureTest {

    @Test
    void setAndClearReturnNewSignatures() {
        ComponentSignature empty = ComponentSignature.empty();
        ComponentSignature withThree = empty.set(3);

        assertTrue(empty.isEmpty());
        assertFalse(empty.has(3));
        assertTrue(withThree.has(3));
        assertEquals(1, withThree.cardinality());

        ComponentSignature cleared = withThree.clear(3);
        assertTrue(cleared.isEmpty());
        assertTrue(withThree.has(3), "original must be unchanged");
    }

    @Test
    void setOfPresentBitReturnsSameInstance() {
        ComponentSignature s = ComponentSignature.empty().set(1);
        assertSame(s, s.set(1));
        assertSame(s, s.clear(7));
    }

    @Test
    @DisplayName("Superset test: (entity & system) == system")
    void containsAllIsSupersetTest() {
        ComponentSignature system = ComponentSignature.builder().with(0).with(2).build();
        ComponentSignature exact = ComponentSignature.builder().with(0).with(2).build();
        ComponentSignature superset = ComponentSignature.builder().with(0).with(1).with(2).build();
        ComponentSignature partial = ComponentSignature.builder().with(0).build();

        assertTrue(exact.containsAll(system));
        assertTrue(superset.containsAll(system));
        assertFalse(partial.containsAll(system));
        assertTrue(partial.containsAll(ComponentSignature.empty()), "everything matches an empty requirement");
    }

    @Test
    void equalityIsByBits() {
        ComponentSignature a = ComponentSignature.empty().set(4).set(9);
        ComponentSignature b = ComponentSignature.builder().with(9).with(4).build();
        assertEquals(a, b);
        assertEquals(a.hashCode(), b.hashCode());
        assertArrayEquals(new int[]{4, 9}, a.toComponentIdArray());
    }

    @Test
    void bitsOutsideCapacityFailFast() {
        ComponentSignature s = ComponentSignature.empty();
        assertThrows(ComponentCapacityExceededException.class, () -> s.set(ComponentSignature.MAX_COMPONENTS));
        assertThrows(ComponentCapacityExceededException.class, () -> s.set(-1));
        assertThrows(ComponentCapacityExceededException.class,
                () -> ComponentSignature.builder().with(ComponentSignature.MAX_COMPONENTS));
        assertFalse(s.has(ComponentSignature.MAX_COMPONENTS));

        ComponentSignature last = s.set(ComponentSignature.MAX_COMPONENTS - 1);
        assertTrue(last.has(31));
    }
}
