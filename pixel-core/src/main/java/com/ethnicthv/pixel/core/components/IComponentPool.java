package com.ethnicthv.pixel.core.components;

/**
 * Type-erased view of a {@link ComponentPool}.
 * <p>
 * The coordinator keeps pools of different component types in one list indexed by type id and
 * only needs this uniform contract to clean up after destroyed entities. Typed access goes through
 * {@link #componentType()} and {@link ComponentPool#cast(Class)}.
 */
public interface IComponentPool {

    /** The component class stored in this pool. */
    Class<? extends Component> componentType();

    /** Remove the entity's component. No-op if the entity has none. */
    void remove(int entityId);

    boolean has(int entityId);

    int size();

    default boolean isEmpty() {
        return size() == 0;
    }

    /** Drop every stored component. */
    void clear();
}
