package com.ethnicthv.pixel.core.system;

import com.ethnicthv.pixel.HealthSystem;
import com.ethnicthv.pixel.MovementSystem;
import com.ethnicthv.pixel.core.SystemNotFoundException;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class SystemRegistryTest {

    @Test
    void systemsAreKeyedByClass() {
        SystemRegistry registry = new SystemRegistry();
        MovementSystem movement = new MovementSystem();

        assertTrue(registry.add(movement).isEmpty());
        assertTrue(registry.has(MovementSystem.class));
        assertSame(movement, registry.get(MovementSystem.class));
        assertFalse(registry.has(HealthSystem.class));
    }

    @Test
    void addingSameClassReplacesAndKeepsOrder() {
        SystemRegistry registry = new SystemRegistry();
        MovementSystem first = new MovementSystem();
        HealthSystem health = new HealthSystem();
        registry.add(first);
        registry.add(health);

        MovementSystem second = new MovementSystem();
        assertSame(first, registry.add(second).orElseThrow());

        assertEquals(2, registry.size());
        assertEquals(List.of(second, health), registry.getRegisteredSystems());
    }

    @Test
    void missingSystemFailsWithNotFound() {
        SystemRegistry registry = new SystemRegistry();
        SystemNotFoundException ex = assertThrows(SystemNotFoundException.class,
                () -> registry.get(MovementSystem.class));
        assertEquals(MovementSystem.class, ex.getSystemClass());
        assertTrue(registry.find(MovementSystem.class).isEmpty());
        assertTrue(registry.remove(MovementSystem.class).isEmpty());
    }

    @Test
    void nullSystemIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> new SystemRegistry().add(null));
    }

    @Test
    void updateSystemsSkipsDisabled() {
        SystemRegistry registry = new SystemRegistry();
        CountingSystem enabled = new CountingSystem();
        registry.add(enabled);
        registry.updateSystems(0.5f);
        enabled.setEnabled(false);
        registry.updateSystems(0.5f);

        assertEquals(1, enabled.updates);
        assertEquals(0.5f, enabled.lastDelta);
    }

    static final class CountingSystem extends BaseSystem {
        int updates;
        float lastDelta;

        @Override
        public void onUpdate(float deltaTime) {
            updates++;
            lastDelta = deltaTime;
        }
    }
}
