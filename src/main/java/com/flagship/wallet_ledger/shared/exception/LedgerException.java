package com.flagship.wallet_ledger.shared.exception;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Base class of every failure the ledger core raises on purpose.
 *
 * Each subclass fixes its {@link ErrorKind} and carries structured details
 * (identifiers, amounts) for diagnostics and for the API error body.
 */
public abstract class LedgerException extends RuntimeException {

    private final ErrorKind kind;
    private final Map<String, Object> details;

    protected LedgerException(ErrorKind kind, String message, Map<String, Object> details) {
        this(kind, message, details, null);
    }

    protected LedgerException(ErrorKind kind, String message, Map<String, Object> details, Throwable cause) {
        super(message, cause);
        this.kind = kind;
        this.details = details == null
            ? Collections.emptyMap()
            : Collections.unmodifiableMap(new LinkedHashMap<>(details));
    }

    public ErrorKind getKind() {
        return kind;
    }

    public Map<String, Object> getDetails() {
        return details;
    }

    public boolean isRetryable() {
        return kind.isRetryable();
    }
}
