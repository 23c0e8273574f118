package com.jay.dcfengine.exception;

/** A provenance tag could not be classified, or a required field carries none. */
public class UnknownProvenanceException extends ValuationException {

    private final String tag;

    public UnknownProvenanceException(String tag) {
        super("Unknown provenance tag: '" + tag + "'");
        this.tag = tag;
    }

    public UnknownProvenanceException(String tag, String message) {
        super(message);
        this.tag = tag;
    }

    public String getTag() {
        return tag;
    }
}
