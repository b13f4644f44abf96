package com.flagship.wallet_ledger.transaction;

import com.flagship.wallet_ledger.shared.Money;
import com.flagship.wallet_ledger.shared.Timestamps;
import com.flagship.wallet_ledger.shared.TransactionId;
import com.flagship.wallet_ledger.shared.TxId;
import com.flagship.wallet_ledger.shared.WalletId;
import com.flagship.wallet_ledger.shared.exception.AlreadyDeactivatedException;
import com.flagship.wallet_ledger.shared.exception.ValidationException;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.time.Instant;
import java.util.Objects;

/**
 * Transaction domain object.
 *
 * A signed monetary movement on exactly one wallet: positive amounts are
 * credits, negative amounts debits, zero is rejected. Everything except the
 * activation state is fixed at creation; deactivation is the only transition
 * and it is irreversible.
 *
 * Deactivating a transaction here does not touch any balance. Balance
 * adjustments belong to the ledger store, which performs them under the
 * wallet row lock.
 */
@Getter
@EqualsAndHashCode(onlyExplicitlyIncluded = true)
@ToString(of = {"id", "walletId", "txid", "amount", "active"})
public class Transaction {

    @EqualsAndHashCode.Include
    private final TransactionId id;
    private final WalletId walletId;
    private final TxId txid;
    private final Money amount;
    private boolean active;
    private Instant deactivatedAt;
    private final Instant createdAt;
    private Instant updatedAt;

    public Transaction(TransactionId id, WalletId walletId, TxId txid, Money amount,
                       boolean active, Instant deactivatedAt, Instant createdAt, Instant updatedAt) {
        this.id = Objects.requireNonNull(id, "id");
        this.walletId = Objects.requireNonNull(walletId, "walletId");
        this.txid = Objects.requireNonNull(txid, "txid");
        if (amount == null || amount.isZero()) {
            throw new ValidationException("Transaction amount cannot be zero");
        }
        if (active == (deactivatedAt != null)) {
            throw new IllegalArgumentException(
                "deactivatedAt must be set if and only if the transaction is inactive: " + id);
        }
        this.amount = amount;
        this.active = active;
        this.deactivatedAt = deactivatedAt;
        this.createdAt = Objects.requireNonNull(createdAt, "createdAt");
        this.updatedAt = Objects.requireNonNull(updatedAt, "updatedAt");
    }

    /**
     * Creates a new, active transaction that has not been persisted yet.
     */
    public static Transaction create(TransactionId id, WalletId walletId, TxId txid, Money amount) {
        Instant now = Timestamps.now();
        return new Transaction(id, walletId, txid, amount, true, null, now, now);
    }

    /**
     * Transitions the transaction to the inactive state.
     *
     * @throws AlreadyDeactivatedException if it is already inactive
     */
    public void deactivate() {
        if (!active) {
            throw AlreadyDeactivatedException.transaction(txid);
        }
        Instant now = Timestamps.now();
        this.active = false;
        this.deactivatedAt = now;
        this.updatedAt = now;
    }

    public boolean isCredit() {
        return amount.isPositive();
    }

    public boolean isDebit() {
        return amount.isNegative();
    }
}
