package com.flagship.wallet_ledger.shared;

import com.flagship.wallet_ledger.shared.exception.ValidationException;
import lombok.Value;

import java.util.UUID;

/**
 * Internal identifier of a transaction. Not exposed as the external reference;
 * see {@link TxId} for that.
 */
@Value
public class TransactionId {
    UUID value;

    private TransactionId(UUID value) {
        if (value == null) {
            throw new ValidationException("Transaction ID is required");
        }
        this.value = value;
    }

    public static TransactionId of(UUID value) {
        return new TransactionId(value);
    }

    public static TransactionId newId() {
        return new TransactionId(UUID.randomUUID());
    }

    @Override
    public String toString() {
        return value.toString();
    }
}
