package org.morm.exception;

import lombok.Getter;

/**
 * A migration unit failed inside its transaction. The transaction has been rolled back
 * and the unit is recorded as failed.
 */
@Getter
public class ApplyException extends MormException {

    private final String model;
    private final long sequence;

    public ApplyException(String model, long sequence, Throwable cause) {
        super(String.format("Migration %s #%d failed: %s", model, sequence, describe(cause)), cause);
        this.model = model;
        this.sequence = sequence;
    }

    /**
     * Message of the root cause, which is where JDBC drivers put the database error text.
     */
    public static String describe(Throwable cause) {
        Throwable root = cause;
        while (root.getCause() != null && root.getCause() != root) {
            root = root.getCause();
        }
        String message = root.getMessage();
        return message != null ? message : root.getClass().getSimpleName();
    }
}
