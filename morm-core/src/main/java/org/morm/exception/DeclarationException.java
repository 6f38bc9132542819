package org.morm.exception;

/**
 * Invalid model declaration: bad field names, reserved-name collisions, unique groups
 * that reference unknown fields and similar. Raised before anything reaches the disk.
 */
public class DeclarationException extends MormException {

    public DeclarationException(String message) {
        super(message);
    }
}
