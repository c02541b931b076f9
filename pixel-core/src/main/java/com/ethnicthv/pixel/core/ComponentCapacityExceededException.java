package com.ethnicthv.pixel.core;

/**
 * Raised when more distinct component types are registered than a signature can hold,
 * or when a signature bit outside the supported range is touched.
 */
public class ComponentCapacityExceededException extends ECSException {
    public ComponentCapacityExceededException(String message) {
        super(message);
    }
}
