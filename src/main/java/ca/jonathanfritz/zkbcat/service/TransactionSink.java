package ca.jonathanfritz.zkbcat.service;

import ca.jonathanfritz.zkbcat.transactions.Transaction;

import java.util.List;

/**
 * Durable storage for confirmed transactions. Implemented by the host application.
 */
@FunctionalInterface
public interface TransactionSink {
    void store(List<Transaction> transactions);
}
