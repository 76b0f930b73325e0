package com.bank.mulegraph.repository;

import com.bank.mulegraph.model.Account;
import com.bank.mulegraph.model.TransactionEdge;

import java.util.List;

/**
 * Read access to the account/transaction graph. Each load returns a finite, consistent snapshot and
 * may be repeated.
 */
public interface GraphStore {

    List<Account> loadAccounts();

    List<TransactionEdge> loadTransactionEdges();

    /** Edges where the account is performer or beneficiary, read fresh for real-time requests. */
    List<TransactionEdge> loadTransactionEdgesFor(long accountId);

    /**
     * Change marker of the stored graph. Writers bump it on every material change; a batch run
     * compares the value read at start with the value read at the end.
     */
    long snapshotMarker();
}
