package com.flagship.wallet_ledger.shared.exception;

/**
 * Closed set of failure kinds raised by the ledger core.
 *
 * Callers switch on the kind instead of parsing messages. The retryable flag
 * marks failures where repeating the whole use case (with freshly loaded state)
 * may succeed.
 */
public enum ErrorKind {
    /** Wallet or transaction missing, or inactive for an active-only lookup. */
    NOT_FOUND(false),

    /** Caller input rejected. Never retried. */
    VALIDATION(false),

    /** Second deactivation of a wallet or transaction, or a write to an inactive wallet. */
    ALREADY_DEACTIVATED(false),

    /** A transaction would drive the wallet balance below zero. */
    INSUFFICIENT_BALANCE(false),

    /** Row lock could not be acquired within the configured bound. */
    BUSY(true),

    /** Duplicate external txid at insert time. */
    CONFLICT(false);

    private final boolean retryable;

    ErrorKind(boolean retryable) {
        this.retryable = retryable;
    }

    public boolean isRetryable() {
        return retryable;
    }
}
