package org.morm.exception;

/**
 * A migration was planned against a snapshot that is no longer the newest one of its model,
 * typically because another generate run queued a unit in the meantime.
 */
public class StaleBaselineException extends MormException {

    public StaleBaselineException(String message) {
        super(message);
    }
}
