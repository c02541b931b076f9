package com.ethnicthv.pixel.core;

/**
 * Base unchecked exception for failures raised by the ECS core.
 * All failures are local and synchronous; the caller decides whether to log and continue or abort.
 */
public class ECSException extends RuntimeException {
    public ECSException(String message) {
        super(message);
    }
    public ECSException(String message, Throwable cause) {
        super(message, cause);
    }
}
