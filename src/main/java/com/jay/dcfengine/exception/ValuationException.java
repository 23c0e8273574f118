package com.jay.dcfengine.exception;

/**
 * Root of every failure raised by the valuation engine.
 * All are fatal to the run except inside the sensitivity grid, where a cell may be marked N/A.
 */
public class ValuationException extends RuntimeException {

    public ValuationException(String message) {
        super(message);
    }

    public ValuationException(String message, Throwable cause) {
        super(message, cause);
    }
}
