package com.flagship.wallet_ledger.ledger;

import com.flagship.wallet_ledger.shared.Money;
import com.flagship.wallet_ledger.shared.Timestamps;
import com.flagship.wallet_ledger.shared.WalletId;
import com.flagship.wallet_ledger.wallet.Wallet;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.PrePersist;
import jakarta.persistence.PreUpdate;
import jakarta.persistence.Table;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.DynamicUpdate;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * JPA Entity for wallet persistence.
 *
 * Key design principles:
 * - No @Setter: balance and activation state change only through the
 *   package-private mutators, which only {@link JpaLedgerStore} calls while it
 *   holds the wallet row lock
 * - @DynamicUpdate: an UPDATE writes only the columns that changed, so no
 *   write ever carries a stale balance back to the row
 * - Controlled factory: fromDomain() is the only way to create entities
 */
@Entity
@Table(
    name = "wallets",
    indexes = {
        @Index(name = "idx_wallets_is_active", columnList = "is_active"),
        @Index(name = "idx_wallets_created_at", columnList = "created_at")
    }
)
@DynamicUpdate
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class WalletEntity {

    @Id
    @Column(nullable = false, updatable = false)
    private UUID id;

    @Column(nullable = false, length = Wallet.MAX_LABEL_LENGTH)
    private String label;

    @Column(nullable = false, precision = 18, scale = 0)
    private BigDecimal balance;

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

    static WalletEntity fromDomain(Wallet wallet) {
        return new WalletEntity(
            wallet.getId().getValue(),
            wallet.getLabel(),
            wallet.getBalance().getAmount(),
            wallet.isActive(),
            wallet.getDeactivatedAt(),
            wallet.getCreatedAt(),
            wallet.getUpdatedAt()
        );
    }

    public Wallet toDomain() {
        return new Wallet(
            WalletId.of(id),
            label,
            Money.of(balance),
            active,
            deactivatedAt,
            createdAt,
            updatedAt
        );
    }

    Money currentBalance() {
        return Money.of(balance);
    }

    /**
     * Writes a balance computed under the wallet row lock.
     */
    void applyBalance(Money newBalance) {
        if (newBalance.isNegative()) {
            throw new IllegalStateException(
                "Refusing to persist negative balance " + newBalance + " for wallet " + id);
        }
        this.balance = newBalance.getAmount();
    }

    void markDeactivated(Instant deactivatedAt) {
        if (!active) {
            throw new IllegalStateException("Wallet " + id + " is already deactivated");
        }
        this.active = false;
        this.deactivatedAt = deactivatedAt;
        this.updatedAt = deactivatedAt;
    }
}
