package com.flagship.wallet_ledger.ledger;

import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.JpaSpecificationExecutor;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Repository for transaction rows.
 */
@Repository
public interface TransactionRepository
        extends JpaRepository<TransactionEntity, UUID>, JpaSpecificationExecutor<TransactionEntity> {

    Optional<TransactionEntity> findByTxid(String txid);

    Optional<TransactionEntity> findByTxidAndActiveTrue(String txid);

    boolean existsByTxid(String txid);

    List<TransactionEntity> findByWalletIdAndActiveTrueOrderByCreatedAtAscIdAsc(UUID walletId);

    List<TransactionEntity> findByWalletIdInAndActiveTrueOrderByCreatedAtAscIdAsc(Collection<UUID> walletIds);

    /**
     * Loads and row-locks every active transaction of a wallet. Used by the
     * deactivation cascade, always after the wallet row itself is locked.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("""
        SELECT t FROM TransactionEntity t
        WHERE t.walletId = :walletId AND t.active = true
        ORDER BY t.createdAt ASC, t.id ASC
        """)
    List<TransactionEntity> findActiveByWalletIdForUpdate(@Param("walletId") UUID walletId);
}
