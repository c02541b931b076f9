package com.ethnicthv.pixel.core.system;

import com.ethnicthv.pixel.core.SystemNotFoundException;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Systems keyed by their concrete class, one instance per class, in registration order.
 * <p>
 * Lifecycle callbacks ({@code onAwake}/{@code onDispose}) are driven by the coordinator; this
 * class only stores and looks up instances.
 */
public class SystemRegistry {
    private final Map<Class<? extends ISystem>, ISystem> systems = new LinkedHashMap<>();

    /**
     * Store a system under its class.
     *
     * @return the instance previously registered under the same class, if any
     */
    public Optional<ISystem> add(ISystem system) {
        if (system == null) {
            throw new IllegalArgumentException("System cannot be null");
        }
        // a replaced instance keeps its original slot in the iteration order
        return Optional.ofNullable(systems.put(system.getClass(), system));
    }

    public Optional<ISystem> remove(Class<? extends ISystem> systemClass) {
        return Optional.ofNullable(systems.remove(systemClass));
    }

    public boolean has(Class<? extends ISystem> systemClass) {
        return systems.containsKey(systemClass);
    }

    /**
     * @throws SystemNotFoundException if no system of that class is registered
     */
    public <T extends ISystem> T get(Class<T> systemClass) {
        return find(systemClass).orElseThrow(() -> new SystemNotFoundException(systemClass));
    }

    public <T extends ISystem> Optional<T> find(Class<T> systemClass) {
        Objects.requireNonNull(systemClass, "systemClass");
        ISystem system = systems.get(systemClass);
        return system == null ? Optional.empty() : Optional.of(systemClass.cast(system));
    }

    /**
     * Returns a snapshot of all registered systems in registration order.
     */
    public List<ISystem> getRegisteredSystems() {
        return new ArrayList<>(systems.values());
    }

    /**
     * Execute all enabled systems once, in registration order.
     * Meant for simple drivers and tests; the frame loop itself lives outside the core.
     */
    public void updateSystems(float deltaTime) {
        for (ISystem sys : getRegisteredSystems()) {
            if (sys.isEnabled()) {
                sys.onUpdate(deltaTime);
            }
        }
    }

    public int size() {
        return systems.size();
    }

    public void clear() {
        systems.clear();
    }
}
