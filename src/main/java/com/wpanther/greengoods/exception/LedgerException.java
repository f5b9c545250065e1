package com.wpanther.greengoods.exception;

/**
 * A ledger call failed or timed out. Retryable from the user's point of view.
 */
public class LedgerException extends RuntimeException {

    public LedgerException(String message) {
        super(message);
    }

    public LedgerException(String message, Throwable cause) {
        super(message, cause);
    }
}
