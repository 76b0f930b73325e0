package com.bank.mulegraph.exception;

/**
 * Thrown when an account number is absent from the current feature snapshot.
 */
public class UnknownAccountException extends RuntimeException {

    private final String accountNumber;

    public UnknownAccountException(String accountNumber) {
        super("Account not present in the current feature snapshot: " + accountNumber);
        this.accountNumber = accountNumber;
    }

    public String getAccountNumber() {
        return accountNumber;
    }
}
