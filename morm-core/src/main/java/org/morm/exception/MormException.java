package org.morm.exception;

/**
 * Base type of every failure raised by the migration engine.
 */
public class MormException extends RuntimeException {

    public MormException(String message) {
        super(message);
    }

    public MormException(String message, Throwable cause) {
        super(message, cause);
    }
}
