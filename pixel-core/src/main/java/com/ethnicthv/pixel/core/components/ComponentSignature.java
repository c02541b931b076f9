package com.ethnicthv.pixel.core.components;

import com.ethnicthv.pixel.core.ComponentCapacityExceededException;

import java.util.BitSet;

/**
 * Fixed-width set of component type ids.
 * <p>
 * Used two ways: per entity, to record which components are attached, and per system, to
 * record which components are required. A system is interested in an entity when the entity
 * signature {@link #containsAll(ComponentSignature) contains all} bits of the system signature.
 * <p>
 * Instances are immutable; {@link #set(int)} and {@link #clear(int)} return new signatures.
 */
public final class ComponentSignature {
    /** Maximum number of distinct component types a signature can hold. */
    public static final int MAX_COMPONENTS = 32;

    private static final ComponentSignature EMPTY = new ComponentSignature(new BitSet(MAX_COMPONENTS));

    private final BitSet mask;
    private final int hashCode;

    private ComponentSignature(BitSet mask) {
        this.mask = (BitSet) mask.clone();
        this.hashCode = mask.hashCode();
    }

    public static ComponentSignature empty() {
        return EMPTY;
    }

    /**
     * Set a component bit in the signature
     */
    public ComponentSignature set(int componentId) {
        checkBounds(componentId);
        if (mask.get(componentId)) {
            return this;
        }
        BitSet newMask = (BitSet) mask.clone();
        newMask.set(componentId);
        return new ComponentSignature(newMask);
    }

    /**
     * Clear a component bit from the signature
     */
    public ComponentSignature clear(int componentId) {
        checkBounds(componentId);
        if (!mask.get(componentId)) {
            return this;
        }
        BitSet newMask = (BitSet) mask.clone();
        newMask.clear(componentId);
        return new ComponentSignature(newMask);
    }

    /**
     * Check if a component is present in the signature
     */
    public boolean has(int componentId) {
        return componentId >= 0 && componentId < MAX_COMPONENTS && mask.get(componentId);
    }

    /**
     * True if this signature is a superset of {@code required}, i.e. {@code (this & required) == required}.
     */
    public boolean containsAll(ComponentSignature required) {
        BitSet diff = (BitSet) required.mask.clone();
        diff.andNot(this.mask);
        return diff.isEmpty();
    }

    public boolean isEmpty() {
        return mask.isEmpty();
    }

    public int cardinality() {
        return mask.cardinality();
    }

    /**
     * Return all set component ids in ascending order.
     */
    public int[] toComponentIdArray() {
        int[] ids = new int[mask.cardinality()];
        int idx = 0;
        for (int bit = mask.nextSetBit(0); bit >= 0; bit = mask.nextSetBit(bit + 1)) {
            ids[idx++] = bit;
        }
        return ids;
    }

    private static void checkBounds(int componentId) {
        if (componentId < 0 || componentId >= MAX_COMPONENTS) {
            throw new ComponentCapacityExceededException(
                    "Component id " + componentId + " is outside the signature range [0, " + MAX_COMPONENTS + ")");
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        ComponentSignature that = (ComponentSignature) o;
        return mask.equals(that.mask);
    }

    @Override
    public int hashCode() {
        return hashCode;
    }

    @Override
    public String toString() {
        return "ComponentSignature{" + mask + '}';
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private final BitSet mask = new BitSet(MAX_COMPONENTS);

        public Builder with(int componentId) {
            checkBounds(componentId);
            mask.set(componentId);
            return this;
        }

        public ComponentSignature build() {
            return mask.isEmpty() ? EMPTY : new ComponentSignature(mask);
        }
    }
}
