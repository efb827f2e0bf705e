package dev.coursebuilder.exception;

/**
 * Malformed submission or review, or an assignment that would break a record invariant.
 */
public class InvalidInputException extends RuntimeException {
    public InvalidInputException(String message) {
        super(message);
    }
}
