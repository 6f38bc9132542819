package org.morm.exception;

/**
 * Raised when a deletion range touches a unit that has already been applied.
 */
public class UnitDeletionException extends MormException {

    public UnitDeletionException(String message) {
        super(message);
    }
}
