package com.driftguard.core.baseline;

/**
 * Thrown when a new baseline snapshot could not be computed or persisted. The
 * previously published snapshot stays in effect.
 *
 * @since 1.0.0
 */
public class BaselinePublishException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public BaselinePublishException(String message) {
        super(message);
    }

    public BaselinePublishException(String message, Throwable cause) {
        super(message, cause);
    }
}
