package com.jay.dcfengine.exception;

/** Malformed fade, driver or discounting parameters. */
public class InvalidAssumptionException extends ValuationException {

    public InvalidAssumptionException(String message) {
        super(message);
    }
}
