package org.smchecker.dataflow.cfg;

/**
 * Thrown when a control flow graph handed to the analysis is not well formed. This is a problem of
 * the input (the front end that produced the graph), not a bug of the analysis.
 */
public class MalformedCFGException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public MalformedCFGException(String message) {
        super(message);
    }

    public MalformedCFGException(String fmt, Object... args) {
        this(String.format(fmt, args));
    }
}
