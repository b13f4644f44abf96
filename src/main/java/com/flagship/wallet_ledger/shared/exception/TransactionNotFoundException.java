package com.flagship.wallet_ledger.shared.exception;

import java.util.Map;

public class TransactionNotFoundException extends NotFoundException {

    private final String reference;

    private TransactionNotFoundException(String message, String key, String reference) {
        super(message, Map.of(key, reference));
        this.reference = reference;
    }

    public static TransactionNotFoundException byTxId(String txid) {
        return new TransactionNotFoundException("Transaction with txid " + txid + " not found", "txid", txid);
    }

    public static TransactionNotFoundException byId(String transactionId) {
        return new TransactionNotFoundException(
            "Transaction with ID " + transactionId + " not found", "transaction_id", transactionId);
    }

    /**
     * The txid or internal ID that was looked up.
     */
    public String getReference() {
        return reference;
    }
}
