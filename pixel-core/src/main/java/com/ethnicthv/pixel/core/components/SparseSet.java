package com.ethnicthv.pixel.core.components;

import java.util.Arrays;

/**
 * Sparse Set for fast entity-to-slot mapping.
 * - O(1) insertion, deletion, lookup
 * - Maintains dense packing for cache-friendly iteration
 * - Both arrays grow by doubling, so entity ids are not bounded up front
 */
public class SparseSet {
    private int[] sparse;  // entity -> dense index
    private int[] dense;   // dense index -> entity
    private int size;

    public SparseSet(int initialCapacity) {
        if (initialCapacity <= 0) {
            throw new IllegalArgumentException("initialCapacity must be > 0");
        }
        this.sparse = new int[initialCapacity];
        this.dense = new int[initialCapacity];
        this.size = 0;
        Arrays.fill(sparse, -1);
    }

    /**
     * Add an entity to the set, returning its dense index.
     * An entity already present keeps its slot.
     */
    public int add(int entityId) {
        if (entityId < 0) {
            throw new IllegalArgumentException("entityId must be >= 0, got " + entityId);
        }
        if (has(entityId)) {
            return sparse[entityId];
        }
        ensureSparse(entityId + 1);
        if (size == dense.length) {
            dense = Arrays.copyOf(dense, dense.length * 2);
        }

        int denseIndex = size;
        sparse[entityId] = denseIndex;
        dense[denseIndex] = entityId;
        size++;
        return denseIndex;
    }

    /**
     * Remove an entity from the set using swap-and-pop.
     *
     * @return the dense index the entity occupied, or -1 if it was absent. After the call the
     *         entity that used to be last (if any) lives at that index.
     */
    public int remove(int entityId) {
        if (!has(entityId)) {
            return -1;
        }

        int denseIndex = sparse[entityId];
        int lastEntity = dense[size - 1];

        // Swap with last element
        dense[denseIndex] = lastEntity;
        sparse[lastEntity] = denseIndex;

        // Mark as removed
        sparse[entityId] = -1;
        size--;
        return denseIndex;
    }

    /**
     * Check if entity exists in the set
     */
    public boolean has(int entityId) {
        return entityId >= 0 && entityId < sparse.length && sparse[entityId] != -1;
    }

    /**
     * Get the dense index for an entity, or -1 if absent
     */
    public int getDenseIndex(int entityId) {
        return has(entityId) ? sparse[entityId] : -1;
    }

    /**
     * Get the entity ID at a dense index
     */
    public int getEntity(int denseIndex) {
        if (denseIndex < 0 || denseIndex >= size) {
            throw new IndexOutOfBoundsException("Dense index " + denseIndex + " out of bounds for size " + size);
        }
        return dense[denseIndex];
    }

    /**
     * Get the number of entities in the set
     */
    public int size() {
        return size;
    }

    /**
     * Clear all entities
     */
    public void clear() {
        Arrays.fill(sparse, -1);
        size = 0;
    }

    private void ensureSparse(int required) {
        if (required <= sparse.length) {
            return;
        }
        int newLength = sparse.length;
        while (newLength < required) {
            newLength *= 2;
        }
        int oldLength = sparse.length;
        sparse = Arrays.copyOf(sparse, newLength);
        Arrays.fill(sparse, oldLength, newLength, -1);
    }
}
