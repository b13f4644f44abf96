package com.flagship.wallet_ledger.shared;

import com.flagship.wallet_ledger.shared.exception.ValidationException;
import lombok.Value;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Signed whole-number monetary amount.
 *
 * There are no fractional units in this ledger: values are stored with scale 0
 * and at most {@value #MAX_DIGITS} digits, matching the NUMERIC(18, 0) columns.
 * Zero is a legal value (an empty wallet); whether zero is acceptable for a
 * particular use is decided by the caller.
 */
@Value
public class Money implements Comparable<Money> {
    public static final int MAX_DIGITS = 18;
    public static final Money ZERO = new Money(BigDecimal.ZERO);

    BigDecimal amount;

    private Money(BigDecimal amount) {
        this.amount = amount;
    }

    public static Money of(BigDecimal amount) {
        if (amount == null) {
            throw new ValidationException("Amount is required");
        }
        if (amount.signum() == 0) {
            return ZERO;
        }
        // Bound the integer digits before rescaling; a huge exponent makes setScale arbitrarily slow.
        if (amount.precision() - amount.scale() > MAX_DIGITS) {
            throw new ValidationException(
                String.format("Amount cannot exceed %d digits: %s", MAX_DIGITS, amount));
        }
        BigDecimal normalized = amount.stripTrailingZeros();
        if (normalized.scale() > 0) {
            throw new ValidationException("Amount must be a whole number: " + amount);
        }
        normalized = normalized.setScale(0, RoundingMode.UNNECESSARY);
        return new Money(normalized);
    }

    public static Money of(long amount) {
        return of(BigDecimal.valueOf(amount));
    }

    public Money plus(Money other) {
        return of(amount.add(other.amount));
    }

    public Money minus(Money other) {
        return of(amount.subtract(other.amount));
    }

    public boolean isZero() {
        return amount.signum() == 0;
    }

    public boolean isPositive() {
        return amount.signum() > 0;
    }

    public boolean isNegative() {
        return amount.signum() < 0;
    }

    @Override
    public int compareTo(Money other) {
        return amount.compareTo(other.amount);
    }

    @Override
    public String toString() {
        return amount.toPlainString();
    }
}
