package com.ethnicthv.pixel.core.components;

import com.ethnicthv.pixel.core.ComponentNotFoundException;

import java.util.Arrays;
import java.util.Objects;
import java.util.Optional;
import java.util.function.BiConsumer;

/**
 * Dense storage for all components of one type.
 * <p>
 * Values sit packed in {@code [0, size)}; a {@link SparseSet} maps entity id to dense index and
 * back. Removal moves the last value into the freed slot, so it is O(1) but dense order is not
 * stable across removals. For every stored entity {@code entityAt(indexOf(e)) == e}.
 *
 * @param <T> component type
 */
public final class ComponentPool<T extends Component> implements IComponentPool {
    public static final int DEFAULT_CAPACITY = 100;

    private final Class<T> type;
    private final SparseSet index;
    private Object[] data;

    public ComponentPool(Class<T> type) {
        this(type, DEFAULT_CAPACITY);
    }

    public ComponentPool(Class<T> type, int initialCapacity) {
        if (initialCapacity <= 0) {
            throw new IllegalArgumentException("initialCapacity must be > 0");
        }
        this.type = Objects.requireNonNull(type, "type");
        this.index = new SparseSet(initialCapacity);
        this.data = new Object[initialCapacity];
    }

    @Override
    public Class<T> componentType() {
        return type;
    }

    /**
     * Store {@code value} for the entity. An existing component is overwritten in place and keeps
     * its dense index; otherwise the value is appended.
     */
    public void set(int entityId, T value) {
        Objects.requireNonNull(value, "value");
        int denseIndex = index.getDenseIndex(entityId);
        if (denseIndex >= 0) {
            data[denseIndex] = type.cast(value);
            return;
        }
        denseIndex = index.add(entityId);
        if (denseIndex >= data.length) {
            data = Arrays.copyOf(data, data.length * 2);
        }
        data[denseIndex] = type.cast(value);
    }

    /**
     * Get the entity's component.
     *
     * @throws ComponentNotFoundException if the entity has no component in this pool
     */
    public T get(int entityId) {
        int denseIndex = index.getDenseIndex(entityId);
        if (denseIndex < 0) {
            throw new ComponentNotFoundException(entityId, type);
        }
        return type.cast(data[denseIndex]);
    }

    public Optional<T> find(int entityId) {
        int denseIndex = index.getDenseIndex(entityId);
        return denseIndex < 0 ? Optional.empty() : Optional.of(type.cast(data[denseIndex]));
    }

    @Override
    public void remove(int entityId) {
        int lastIndex = index.size() - 1;
        int freed = index.remove(entityId);
        if (freed < 0) {
            return;
        }
        data[freed] = data[lastIndex];
        data[lastIndex] = null;
    }

    @Override
    public boolean has(int entityId) {
        return index.has(entityId);
    }

    @Override
    public int size() {
        return index.size();
    }

    /** Dense index of the entity's component, or -1. */
    public int indexOf(int entityId) {
        return index.getDenseIndex(entityId);
    }

    /** Component stored at a dense index in {@code [0, size)}. */
    public T getAt(int denseIndex) {
        if (denseIndex < 0 || denseIndex >= index.size()) {
            throw new IndexOutOfBoundsException("Dense index " + denseIndex + " out of bounds for size " + index.size());
        }
        return type.cast(data[denseIndex]);
    }

    /** Entity owning the component at a dense index in {@code [0, size)}. */
    public int entityAt(int denseIndex) {
        return index.getEntity(denseIndex);
    }

    /** Iterate the dense range in storage order. The consumer must not add or remove components. */
    public void forEach(BiConsumer<Integer, T> fn) {
        int n = index.size();
        for (int i = 0; i < n; i++) {
            fn.accept(index.getEntity(i), type.cast(data[i]));
        }
    }

    @Override
    public void clear() {
        Arrays.fill(data, 0, index.size(), null);
        index.clear();
    }

    /**
     * Checked downcast of this pool to a typed view. Fails if {@code expected} is not the stored type.
     */
    @SuppressWarnings("unchecked")
    public <U extends Component> ComponentPool<U> cast(Class<U> expected) {
        if (expected != type) {
            throw new ClassCastException("Pool holds " + type.getName() + ", not " + expected.getName());
        }
        return (ComponentPool<U>) this;
    }

    @Override
    public String toString() {
        return "ComponentPool{" + type.getSimpleName() + ", size=" + index.size() + '}';
    }
}
