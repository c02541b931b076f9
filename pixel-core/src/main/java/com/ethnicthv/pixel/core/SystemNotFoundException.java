package com.ethnicthv.pixel.core;

/**
 * Thrown when a system type is looked up but was never registered (or was removed).
 */
public class SystemNotFoundException extends ECSException {
    private final Class<?> systemClass;

    public SystemNotFoundException(Class<?> systemClass) {
        super("System " + systemClass.getName() + " is not registered");
        this.systemClass = systemClass;
    }

    public Class<?> getSystemClass() {
        return systemClass;
    }
}
