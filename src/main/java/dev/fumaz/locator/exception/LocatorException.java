package dev.fumaz.locator.exception;

/**
 * Base unchecked exception for locator failures.
 */
public class LocatorException extends RuntimeException {

    public LocatorException(String message) {
        super(message);
    }
}
