package dev.coursebuilder.exception;

/**
 * Base for lookups that reference a work record or reviewer entry that does not exist.
 */
public abstract class NotFoundException extends RuntimeException {
    protected NotFoundException(String message) {
        super(message);
    }
}
