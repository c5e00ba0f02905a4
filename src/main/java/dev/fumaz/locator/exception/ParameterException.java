package dev.fumaz.locator.exception;

/**
 * Signals that a producer asked for a construction parameter that was not supplied.
 */
public class ParameterException extends LocatorException {

    public ParameterException(String message) {
        super(message);
    }
}
