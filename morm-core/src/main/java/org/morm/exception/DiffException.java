package org.morm.exception;

/**
 * Two snapshots could not be compared (e.g. they describe different tables).
 */
public class DiffException extends MormException {

    public DiffException(String message) {
        super(message);
    }
}
