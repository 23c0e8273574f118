package com.jay.dcfengine.exception;

/** Per-share value requested against a zero or negative share count. */
public class DivisionByZeroException extends ValuationException {

    public DivisionByZeroException(String message) {
        super(message);
    }
}
