package com.flagship.wallet_ledger.shared.exception;

import java.util.Map;

/**
 * Unique constraint hit at insert time, e.g. a duplicate external txid.
 */
public class ConflictException extends LedgerException {

    public ConflictException(String message, Map<String, Object> details, Throwable cause) {
        super(ErrorKind.CONFLICT, message, details, cause);
    }

    public static ConflictException duplicateTxId(String txid, Throwable cause) {
        return new ConflictException("Transaction with txid " + txid + " already exists", Map.of("txid", txid), cause);
    }
}
