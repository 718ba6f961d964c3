package utils;

/**
 * Thrown when an internal consistency check fails, e.g. the equality engine reports a class
 * that does not contain the term it was asked about. Never caught inside this project.
 */
public class InvariantViolationException extends RuntimeException {

    public InvariantViolationException(String message) {
        super(message);
    }
}
