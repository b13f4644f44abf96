package com.flagship.wallet_ledger.wallet;

import com.flagship.wallet_ledger.shared.Money;
import com.flagship.wallet_ledger.shared.Timestamps;
import com.flagship.wallet_ledger.shared.WalletId;
import com.flagship.wallet_ledger.shared.exception.AlreadyDeactivatedException;
import com.flagship.wallet_ledger.shared.exception.ValidationException;
import com.flagship.wallet_ledger.transaction.Transaction;
import lombok.AccessLevel;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Wallet domain object.
 *
 * Holds a snapshot of the durable wallet plus the transactions attached to it
 * during the current use case.
 *
 * The balance held here is NOT authoritative. {@link #addTransaction} does not
 * recompute it: two callers holding separately loaded copies of the same wallet
 * would both compute from the same stale value and one update would be lost.
 * The ledger store recomputes the balance from the locked wallet row and is the
 * only writer of balance and activation state. Do not move balance arithmetic
 * into this class.
 */
@Getter
@EqualsAndHashCode(onlyExplicitlyIncluded = true)
@ToString(of = {"id", "label", "balance", "active"})
public class Wallet {
    public static final int MAX_LABEL_LENGTH = 255;

    @EqualsAndHashCode.Include
    private final WalletId id;
    private String label;
    private final Money balance;
    private boolean active;
    private Instant deactivatedAt;
    private final Instant createdAt;
    private Instant updatedAt;

    @Getter(AccessLevel.NONE)
    private final List<Transaction> transactions = new ArrayList<>();

    public Wallet(WalletId id, String label, Money balance, boolean active,
                  Instant deactivatedAt, Instant createdAt, Instant updatedAt) {
        this.id = Objects.requireNonNull(id, "id");
        this.label = Objects.requireNonNull(label, "label");
        this.balance = Objects.requireNonNull(balance, "balance");
        if (active == (deactivatedAt != null)) {
            throw new IllegalArgumentException(
                "deactivatedAt must be set if and only if the wallet is inactive: " + id);
        }
        this.active = active;
        this.deactivatedAt = deactivatedAt;
        this.createdAt = Objects.requireNonNull(createdAt, "createdAt");
        this.updatedAt = Objects.requireNonNull(updatedAt, "updatedAt");
    }

    /**
     * Creates a new, active wallet with a zero balance.
     *
     * @throws ValidationException if the label is blank or too long
     */
    public static Wallet create(WalletId id, String label) {
        Instant now = Timestamps.now();
        return new Wallet(id, normalizeLabel(label), Money.ZERO, true, null, now, now);
    }

    /**
     * Trims and validates a wallet label.
     */
    public static String normalizeLabel(String label) {
        if (label == null || label.isBlank()) {
            throw new ValidationException("Wallet label cannot be empty");
        }
        String trimmed = label.strip();
        if (trimmed.length() > MAX_LABEL_LENGTH) {
            throw new ValidationException(
                String.format("Wallet label cannot exceed %d characters", MAX_LABEL_LENGTH));
        }
        return trimmed;
    }

    public void updateLabel(String newLabel) {
        this.label = normalizeLabel(newLabel);
        this.updatedAt = Timestamps.now();
    }

    /**
     * Attaches a transaction to this in-memory wallet. Balance is left alone.
     *
     * @throws AlreadyDeactivatedException if the wallet is inactive
     * @throws ValidationException if the transaction belongs to another wallet
     */
    public void addTransaction(Transaction transaction) {
        if (!active) {
            throw AlreadyDeactivatedException.walletRejectsTransactions(id);
        }
        if (!id.equals(transaction.getWalletId())) {
            throw new ValidationException(
                String.format("Transaction %s belongs to wallet %s, not %s",
                    transaction.getTxid(), transaction.getWalletId(), id));
        }
        transactions.add(transaction);
        this.updatedAt = Timestamps.now();
    }

    /**
     * Deactivates the wallet and every in-memory transaction that is still active.
     *
     * Transactions not loaded into this instance are deactivated durably by the
     * ledger store's cascade, not here.
     *
     * @throws AlreadyDeactivatedException if the wallet is already inactive
     */
    public void deactivate() {
        ensureActive();
        Instant now = Timestamps.now();
        this.active = false;
        this.deactivatedAt = now;
        this.updatedAt = now;
        for (Transaction transaction : transactions) {
            if (transaction.isActive()) {
                transaction.deactivate();
            }
        }
    }

    /**
     * @throws AlreadyDeactivatedException if the wallet is inactive
     */
    public void ensureActive() {
        if (!active) {
            throw AlreadyDeactivatedException.wallet(id);
        }
    }

    public List<Transaction> getTransactions() {
        return List.copyOf(transactions);
    }

    public List<Transaction> getActiveTransactions() {
        return transactions.stream()
            .filter(Transaction::isActive)
            .toList();
    }

    /**
     * Sums the active in-memory transactions. Useful for verification, never
     * used as the persisted balance.
     */
    public Money calculateBalanceFromTransactions() {
        return getActiveTransactions().stream()
            .map(Transaction::getAmount)
            .reduce(Money.ZERO, Money::plus);
    }
}
