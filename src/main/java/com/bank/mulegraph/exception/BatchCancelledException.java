package com.bank.mulegraph.exception;

public class BatchCancelledException extends RuntimeException {

    public BatchCancelledException(String message) {
        super(message);
    }
}
