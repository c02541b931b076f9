package com.ethnicthv.pixel;

import com.ethnicthv.pixel.core.components.Component;
import com.ethnicthv.pixel.core.components.ComponentPool;

import java.util.List;
import java.util.Objects;

/**
 * Immutable settings for a {@link Coordinator}, normally produced by {@link Coordinator.Builder}.
 *
 * @param initialPoolCapacity   slots allocated by each component pool when it is first created
 * @param initialEntityCapacity initial size of the per-entity signature table (doubles on demand)
 * @param rescanOnSystemAdd     match a newly added or replacing system against every live entity;
 *                              when false only entities created afterwards are matched
 * @param components            component classes registered up front, in id order
 */
public record CoordinatorConfig(int initialPoolCapacity,
                                int initialEntityCapacity,
                                boolean rescanOnSystemAdd,
                                List<Class<? extends Component>> components) {

    public static final int DEFAULT_ENTITY_CAPACITY = 2;

    public CoordinatorConfig {
        if (initialPoolCapacity <= 0) {
            throw new IllegalArgumentException("initialPoolCapacity must be > 0");
        }
        if (initialEntityCapacity <= 0) {
            throw new IllegalArgumentException("initialEntityCapacity must be > 0");
        }
        components = List.copyOf(Objects.requireNonNull(components, "components"));
    }

    public static CoordinatorConfig defaults() {
        return new CoordinatorConfig(ComponentPool.DEFAULT_CAPACITY, DEFAULT_ENTITY_CAPACITY, true, List.of());
    }
}
