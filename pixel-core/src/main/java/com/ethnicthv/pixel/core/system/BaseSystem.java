package com.ethnicthv.pixel.core.system;

import com.ethnicthv.pixel.Coordinator;
import com.ethnicthv.pixel.core.components.Component;
import com.ethnicthv.pixel.core.components.ComponentSignature;
import com.ethnicthv.pixel.core.entity.Entity;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Convenience base class for systems.
 *
 * Provides:
 * - {@link #requireComponent(Class)} to declare the required signature, usually from the constructor
 * - stored reference to the {@link Coordinator} after {@link #onAwake(Coordinator)}
 * - the matched-entity list with O(1) membership checks
 * - default {@link #onDispose()} implementation (no-op) and an enabled flag
 *
 * Subclasses must implement {@link #onUpdate(float)}.
 */
public abstract class BaseSystem implements ISystem {

    protected Coordinator coordinator;
    private boolean enabled = true;

    private final Set<Class<? extends Component>> requiredComponents = new LinkedHashSet<>();
    private ComponentSignature componentSignature = ComponentSignature.empty();

    private final List<Entity> entities = new ArrayList<>();
    private final Set<Entity> members = new HashSet<>();
    private final List<Entity> entitiesView = Collections.unmodifiableList(entities);

    /**
     * Declare that matched entities must carry {@code componentClass}.
     * <p>
     * Before registration the class is only recorded and resolved in {@link #onAwake(Coordinator)}.
     * Afterwards it is resolved at once, but only entities reconciled from then on see the new requirement.
     */
    protected final void requireComponent(Class<? extends Component> componentClass) {
        Objects.requireNonNull(componentClass, "componentClass");
        requiredComponents.add(componentClass);
        if (coordinator != null) {
            componentSignature = componentSignature.set(coordinator.registerComponent(componentClass));
        }
    }

    @Override
    public void onAwake(Coordinator coordinator) {
        this.coordinator = coordinator;
        ComponentSignature.Builder builder = ComponentSignature.builder();
        for (Class<? extends Component> required : requiredComponents) {
            builder.with(coordinator.registerComponent(required));
        }
        componentSignature = builder.build();
    }

    @Override
    public void onDispose() {
        // Default: no-op. Override if the system owns external resources.
    }

    @Override
    public boolean isEnabled() {
        return enabled;
    }

    @Override
    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    @Override
    public ComponentSignature getComponentSignature() {
        return componentSignature;
    }

    /** Classes declared through {@link #requireComponent(Class)}, in declaration order. */
    public Set<Class<? extends Component>> getRequiredComponents() {
        return Collections.unmodifiableSet(requiredComponents);
    }

    @Override
    public List<Entity> getSystemEntities() {
        return entitiesView;
    }

    @Override
    public void addEntityToSystem(Entity entity) {
        if (members.add(entity)) {
            entities.add(entity);
        }
    }

    @Override
    public void removeEntityFromSystem(Entity entity) {
        if (members.remove(entity)) {
            entities.remove(entity);
        }
    }

    @Override
    public boolean hasEntity(Entity entity) {
        return members.contains(entity);
    }

    @Override
    public void clearEntities() {
        entities.clear();
        members.clear();
    }

    // Note: onUpdate(float deltaTime) remains abstract to force subclasses
    // to provide their own update logic.
}
