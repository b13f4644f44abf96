package com.flagship.wallet_ledger.shared;

import com.flagship.wallet_ledger.shared.exception.ValidationException;
import lombok.Value;

/**
 * Externally visible transaction identifier.
 *
 * Always generated by the system, never supplied by clients. Case-sensitive,
 * at most {@value #MAX_LENGTH} characters, unique across all transactions.
 */
@Value
public class TxId {
    public static final int MAX_LENGTH = 255;

    String value;

    private TxId(String value) {
        if (value == null || value.isBlank()) {
            throw new ValidationException("Transaction txid cannot be blank");
        }
        if (value.length() > MAX_LENGTH) {
            throw new ValidationException(
                String.format("Transaction txid cannot exceed %d characters", MAX_LENGTH));
        }
        this.value = value;
    }

    public static TxId of(String value) {
        return new TxId(value);
    }

    @Override
    public String toString() {
        return value;
    }
}
