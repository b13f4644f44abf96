package com.flagship.wallet_ledger.ledger;

import com.flagship.wallet_ledger.shared.Money;
import com.flagship.wallet_ledger.shared.Timestamps;
import com.flagship.wallet_ledger.shared.TransactionId;
import com.flagship.wallet_ledger.shared.TxId;
import com.flagship.wallet_ledger.shared.WalletId;
import com.flagship.wallet_ledger.transaction.Transaction;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.PrePersist;
import jakarta.persistence.PreUpdate;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * JPA Entity for transaction persistence.
 *
 * Immutable fields (id, wallet, txid, amount, created_at) are updatable = false.
 * The only mutation is deactivation, performed by {@link JpaLedgerStore} inside
 * the wallet cascade.
 */
@Entity
@Table(
    name = "transactions",
    uniqueConstraints = {
        @UniqueConstraint(name = TransactionEntity.TXID_CONSTRAINT, columnNames = "txid")
    },
    indexes = {
        @Index(name = "idx_transactions_wallet_id_is_active", columnList = "wallet_id, is_active"),
        @Index(name = "idx_transactions_created_at", columnList = "created_at")
    }
)
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class TransactionEntity {

    static final String TXID_CONSTRAINT = "uq_transactions_txid";

    @Id
    @Column(nullable = false, updatable = false)
    private UUID id;

    @Column(name = "wallet_id", nullable = false, updatable = false)
    private UUID walletId;

    @Column(nullable = false, updatable = false, length = TxId.MAX_LENGTH)
    private String txid;

    @Column(nullable = false, updatable = false, precision = 18, scale = 0)
    private BigDecimal amount;

    @Column(name = "is_active", nullable = false)
    private boolean active;

    @Column(name = "deactivated_at")
    private Instant deactivatedAt;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @PrePersist
    void onCreate() {
        if (createdAt == null) {
            createdAt = Timestamps.now();
        }
        if (updatedAt == null) {
            updatedAt = createdAt;
        }
    }

    @PreUpdate
    void onUpdate() {
        // A deactivation stamps updated_at with the shared deactivation time
        if (!active && deactivatedAt != null && deactivatedAt.equals(updatedAt)) {
            return;
        }
        Instant now = Timestamps.now();
        if (updatedAt == null || now.isAfter(updatedAt)) {
            updatedAt = now;
        }
    }

    static TransactionEntity fromDomain(Transaction transaction) {
        return new TransactionEntity(
            transaction.getId().getValue(),
            transaction.getWalletId().getValue(),
            transaction.getTxid().getValue(),
            transaction.getAmount().getAmount(),
            transaction.isActive(),
            transaction.getDeactivatedAt(),
            transaction.getCreatedAt(),
            transaction.getUpdatedAt()
        );
    }

    public Transaction toDomain() {
        return new Transaction(
            TransactionId.of(id),
            WalletId.of(walletId),
            TxId.of(txid),
            Money.of(amount),
            active,
            deactivatedAt,
            createdAt,
            updatedAt
        );
    }

    Money signedAmount() {
        return Money.of(amount);
    }

    void markDeactivated(Instant deactivatedAt) {
        if (!active) {
            throw new IllegalStateException("Transaction " + txid + " is already deactivated");
        }
        this.active = false;
        this.deactivatedAt = deactivatedAt;
        this.updatedAt = deactivatedAt;
    }
}
