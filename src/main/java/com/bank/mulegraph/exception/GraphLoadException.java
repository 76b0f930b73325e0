package com.bank.mulegraph.exception;

/**
 * Thrown when the graph snapshot cannot be projected: a dangling account reference,
 * a negative amount or an edge with a missing endpoint. Fatal to the current batch run only.
 */
public class GraphLoadException extends RuntimeException {

    public GraphLoadException(String message) {
        super(message);
    }

    public GraphLoadException(String message, Throwable cause) {
        super(message, cause);
    }
}
