package com.ethnicthv.pixel.core.components;

/**
 * Marker interface for component classes.
 * <p>
 * A component is pure data. Each concrete class gets its own pool and its own bit in
 * {@link ComponentSignature}; instances are stored by reference, so mutating the object
 * returned by {@code getComponent} mutates the stored component.
 */
public interface Component {
}
