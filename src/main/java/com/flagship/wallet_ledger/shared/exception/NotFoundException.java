package com.flagship.wallet_ledger.shared.exception;

import java.util.Map;

/**
 * Lookup miss. Subclasses name the resource and embed its identifier.
 */
public abstract class NotFoundException extends LedgerException {

    protected NotFoundException(String message, Map<String, Object> details) {
        super(ErrorKind.NOT_FOUND, message, details);
    }
}
