package com.ethnicthv.pixel.core;

/**
 * Thrown when a component is requested from an entity that does not carry it,
 * or when no pool exists yet for the requested component type.
 */
public class ComponentNotFoundException extends ECSException {
    private final int entityId;
    private final Class<?> componentClass;

    public ComponentNotFoundException(int entityId, Class<?> componentClass) {
        super("Entity " + entityId + " has no component " + componentClass.getName());
        this.entityId = entityId;
        this.componentClass = componentClass;
    }

    public int getEntityId() {
        return entityId;
    }

    public Class<?> getComponentClass() {
        return componentClass;
    }
}
