package com.flagship.wallet_ledger.shared.exception;

import java.util.Map;

/**
 * Caller-fixable input error: blank label, zero amount, malformed filter.
 */
public class ValidationException extends LedgerException {

    public ValidationException(String message) {
        super(ErrorKind.VALIDATION, message, Map.of());
    }

    public ValidationException(String message, Map<String, Object> details) {
        super(ErrorKind.VALIDATION, message, details);
    }
}
