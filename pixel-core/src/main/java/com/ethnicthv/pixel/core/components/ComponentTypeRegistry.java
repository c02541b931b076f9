package com.ethnicthv.pixel.core.components;

import com.ethnicthv.pixel.core.ComponentCapacityExceededException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Collections;
import java.util.Map;
import java.util.Objects;
import java.util.OptionalInt;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * ComponentTypeRegistry - assigns each component class a stable small integer id.
 * <p>
 * Ids are handed out in registration order starting at 0 and never change for the lifetime of
 * the registry. One registry is owned by each coordinator, so several coordinators can coexist
 * without sharing id state. At most {@link ComponentSignature#MAX_COMPONENTS} types fit.
 */
public class ComponentTypeRegistry {
    private static final Logger LOG = LogManager.getLogger(ComponentTypeRegistry.class);

    private final ConcurrentHashMap<Class<?>, Integer> componentTypeIds = new ConcurrentHashMap<>();
    private final AtomicInteger nextTypeId = new AtomicInteger(0);

    /**
     * Register a component class, returning its type id. Idempotent.
     *
     * @throws IllegalArgumentException            if the class does not implement {@link Component}
     * @throws ComponentCapacityExceededException if all signature bits are already taken
     */
    public int register(Class<? extends Component> componentClass) {
        Objects.requireNonNull(componentClass, "componentClass");
        if (!Component.class.isAssignableFrom(componentClass)) {
            throw new IllegalArgumentException(
                    componentClass.getName() + " must implement Component interface");
        }
        Integer existing = componentTypeIds.get(componentClass);
        if (existing != null) {
            return existing;
        }
        // Assign a stable type id exactly once, even under races
        return componentTypeIds.computeIfAbsent(componentClass, cls -> {
            int id = nextTypeId.getAndIncrement();
            if (id >= ComponentSignature.MAX_COMPONENTS) {
                // counter stays past the limit; every later registration fails the same way
                throw new ComponentCapacityExceededException("Cannot register " + cls.getName()
                        + ": all " + ComponentSignature.MAX_COMPONENTS + " component type ids are in use");
            }
            LOG.debug("Registered component type {} with id {}", cls.getSimpleName(), id);
            return id;
        });
    }

    /**
     * Get component type id, or {@code null} if the class was never registered.
     */
    public Integer getTypeId(Class<?> componentClass) {
        return componentTypeIds.get(componentClass);
    }

    public OptionalInt findTypeId(Class<?> componentClass) {
        Integer id = componentTypeIds.get(componentClass);
        return id == null ? OptionalInt.empty() : OptionalInt.of(id);
    }

    public boolean isRegistered(Class<?> componentClass) {
        return componentTypeIds.containsKey(componentClass);
    }

    /**
     * Get all registered component classes
     */
    public Set<Class<?>> getRegisteredComponents() {
        return Collections.unmodifiableSet(componentTypeIds.keySet());
    }

    /** Snapshot of the class to id mapping. */
    public Map<Class<?>, Integer> snapshot() {
        return Map.copyOf(componentTypeIds);
    }

    public int size() {
        return componentTypeIds.size();
    }
}
