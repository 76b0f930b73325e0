package com.bank.mulegraph.exception;

public class BatchAlreadyRunningException extends RuntimeException {

    public BatchAlreadyRunningException() {
        super("A graph feature batch run is already in progress");
    }
}
