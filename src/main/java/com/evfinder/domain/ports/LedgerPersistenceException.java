package com.evfinder.domain.ports;

/**
 * Raised when the ledger record cannot be read or replaced.
 */
public class LedgerPersistenceException extends RuntimeException {

    public LedgerPersistenceException(String message, Throwable cause) {
        super(message, cause);
    }
}
