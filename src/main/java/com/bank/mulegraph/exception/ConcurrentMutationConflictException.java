package com.bank.mulegraph.exception;

/**
 * Thrown when the graph store changed while a batch run was reading it.
 */
public class ConcurrentMutationConflictException extends RuntimeException {

    public ConcurrentMutationConflictException(long markerAtStart, long markerAtEnd) {
        super("Graph store changed during batch run (marker " + markerAtStart + " -> " + markerAtEnd + ")");
    }
}
