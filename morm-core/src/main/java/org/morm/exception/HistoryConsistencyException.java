package org.morm.exception;

/**
 * The applied baseline and the migration unit history disagree. Needs manual reconciliation.
 */
public class HistoryConsistencyException extends MormException {

    public HistoryConsistencyException(String message) {
        super(message);
    }
}
