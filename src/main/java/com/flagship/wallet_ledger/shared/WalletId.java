package com.flagship.wallet_ledger.shared;

import com.flagship.wallet_ledger.shared.exception.ValidationException;
import lombok.Value;

import java.util.UUID;

/**
 * Identifier of a wallet. Random 128-bit value, immutable once assigned.
 */
@Value
public class WalletId {
    UUID value;

    private WalletId(UUID value) {
        if (value == null) {
            throw new ValidationException("Wallet ID is required");
        }
        this.value = value;
    }

    public static WalletId of(UUID value) {
        return new WalletId(value);
    }

    public static WalletId newId() {
        return new WalletId(UUID.randomUUID());
    }

    /**
     * Parses a wallet ID from its string form.
     *
     * @throws ValidationException if the string is not a UUID
     */
    public static WalletId parse(String value) {
        try {
            return new WalletId(UUID.fromString(value));
        } catch (IllegalArgumentException | NullPointerException e) {
            throw new ValidationException("Invalid wallet ID format: " + value);
        }
    }

    @Override
    public String toString() {
        return value.toString();
    }
}
