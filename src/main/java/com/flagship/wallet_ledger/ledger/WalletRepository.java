package com.flagship.wallet_ledger.ledger;

import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.JpaSpecificationExecutor;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.Optional;
import java.util.UUID;

/**
 * Repository for wallet rows.
 *
 * Only {@link JpaLedgerStore} uses it; everything else goes through
 * {@link LedgerStore}.
 */
@Repository
public interface WalletRepository extends JpaRepository<WalletEntity, UUID>, JpaSpecificationExecutor<WalletEntity> {

    Optional<WalletEntity> findByIdAndActiveTrue(UUID id);

    /**
     * Loads the wallet with SELECT ... FOR UPDATE. Blocks until concurrent
     * writers of the same row commit, or until the transaction's lock_timeout.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT w FROM WalletEntity w WHERE w.id = :id")
    Optional<WalletEntity> findByIdForUpdate(@Param("id") UUID id);

    /**
     * Single-row label update. Touches label and updated_at only, never the
     * balance or activation columns.
     *
     * @return number of rows updated (0 if missing or inactive)
     */
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
        UPDATE WalletEntity w
        SET w.label = :label, w.updatedAt = :updatedAt
        WHERE w.id = :id AND w.active = true
        """)
    int updateLabelOfActiveWallet(@Param("id") UUID id,
                                  @Param("label") String label,
                                  @Param("updatedAt") Instant updatedAt);
}
