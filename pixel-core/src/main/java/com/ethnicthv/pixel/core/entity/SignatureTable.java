package com.ethnicthv.pixel.core.entity;

import com.ethnicthv.pixel.core.components.ComponentSignature;

import java.util.Arrays;

/**
 * Per-entity component signatures indexed by entity id.
 * <p>
 * Capacity doubles whenever an id does not fit; unused slots read as the empty signature.
 */
public final class SignatureTable {
    private ComponentSignature[] signatures;

    public SignatureTable(int initialCapacity) {
        if (initialCapacity <= 0) {
            throw new IllegalArgumentException("initialCapacity must be > 0");
        }
        this.signatures = new ComponentSignature[initialCapacity];
        Arrays.fill(signatures, ComponentSignature.empty());
    }

    /** Grow (by doubling) until {@code entityId} is a valid slot. */
    public void ensureCapacity(int entityId) {
        if (entityId < signatures.length) {
            return;
        }
        int newCapacity = signatures.length;
        while (newCapacity <= entityId) {
            newCapacity *= 2;
        }
        int oldCapacity = signatures.length;
        signatures = Arrays.copyOf(signatures, newCapacity);
        Arrays.fill(signatures, oldCapacity, newCapacity, ComponentSignature.empty());
    }

    public ComponentSignature get(int entityId) {
        if (entityId < 0 || entityId >= signatures.length) {
            return ComponentSignature.empty();
        }
        return signatures[entityId];
    }

    public void set(int entityId, ComponentSignature signature) {
        ensureCapacity(entityId);
        signatures[entityId] = signature;
    }

    public void reset(int entityId) {
        if (entityId >= 0 && entityId < signatures.length) {
            signatures[entityId] = ComponentSignature.empty();
        }
    }

    /** Reset every slot to the empty signature. Capacity is kept. */
    public void clear() {
        Arrays.fill(signatures, ComponentSignature.empty());
    }

    public int capacity() {
        return signatures.length;
    }
}
