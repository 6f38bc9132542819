package org.morm.exception;

/**
 * A change record could not be rendered as DDL. Always raised before a unit is written.
 */
public class GenerationException extends MormException {

    public GenerationException(String message) {
        super(message);
    }
}
