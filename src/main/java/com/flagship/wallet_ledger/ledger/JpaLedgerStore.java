package com.flagship.wallet_ledger.ledger;

import com.flagship.wallet_ledger.shared.Money;
import com.flagship.wallet_ledger.shared.PageQuery;
import com.flagship.wallet_ledger.shared.PageResult;
import com.flagship.wallet_ledger.shared.Timestamps;
import com.flagship.wallet_ledger.shared.TransactionId;
import com.flagship.wallet_ledger.shared.TxId;
import com.flagship.wallet_ledger.shared.WalletId;
import com.flagship.wallet_ledger.shared.exception.AlreadyDeactivatedException;
import com.flagship.wallet_ledger.shared.exception.ConflictException;
import com.flagship.wallet_ledger.shared.exception.InsufficientBalanceException;
import com.flagship.wallet_ledger.shared.exception.LockTimeoutException;
import com.flagship.wallet_ledger.shared.exception.ValidationException;
import com.flagship.wallet_ledger.shared.exception.WalletNotFoundException;
import com.flagship.wallet_ledger.transaction.Transaction;
import com.flagship.wallet_ledger.transaction.TransactionFilter;
import com.flagship.wallet_ledger.wallet.Wallet;
import com.flagship.wallet_ledger.wallet.WalletFilter;
import jakarta.persistence.criteria.Predicate;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.dao.PessimisticLockingFailureException;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Pageable;
import org.springframework.data.domain.Sort;
import org.springframework.data.jpa.domain.Specification;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.transaction.annotation.Transactional;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Function;

/**
 * PostgreSQL implementation of {@link LedgerStore} on Spring Data JPA.
 *
 * Both atomic protocols run in one database transaction and start by taking
 * the wallet row lock (SELECT ... FOR UPDATE). Every balance-affecting
 * operation on a wallet takes that same lock first, so they are serialized per
 * wallet while different wallets proceed independently.
 *
 * The wait for the lock is bounded by PostgreSQL's {@code lock_timeout}, set
 * with {@code SET LOCAL} semantics so it expires with the transaction. A timeout
 * surfaces as {@link LockTimeoutException}; nothing is retried here because a
 * blind retry inside the unit could apply a balance change twice.
 *
 * Database constraints back the same invariants (non-negative balance, non-zero
 * amount, unique txid) as a final safety net.
 */
@Slf4j
public class JpaLedgerStore implements LedgerStore {

    private final WalletRepository walletRepository;
    private final TransactionRepository transactionRepository;
    private final JdbcTemplate jdbcTemplate;
    private final Duration lockTimeout;

    public JpaLedgerStore(WalletRepository walletRepository,
                          TransactionRepository transactionRepository,
                          JdbcTemplate jdbcTemplate,
                          Duration lockTimeout) {
        this.walletRepository = walletRepository;
        this.transactionRepository = transactionRepository;
        this.jdbcTemplate = jdbcTemplate;
        this.lockTimeout = lockTimeout;
    }

    // ==================== Wallets ====================

    @Override
    @Transactional
    public Wallet insertWallet(Wallet wallet) {
        if (!wallet.isActive() || !wallet.getBalance().isZero()) {
            throw new IllegalArgumentException(
                "New wallets must be active with a zero balance: " + wallet.getId());
        }
        WalletEntity saved = walletRepository.saveAndFlush(WalletEntity.fromDomain(wallet));
        log.debug("Inserted wallet {}", saved.getId());
        return saved.toDomain();
    }

    @Override
    @Transactional
    public Wallet updateWalletLabel(Wallet wallet) {
        UUID id = wallet.getId().getValue();
        int updated = walletRepository.updateLabelOfActiveWallet(id, wallet.getLabel(), wallet.getUpdatedAt());
        if (updated == 0) {
            WalletEntity existing = walletRepository.findById(id)
                .orElseThrow(() -> new WalletNotFoundException(wallet.getId()));
            if (!existing.isActive()) {
                throw AlreadyDeactivatedException.wallet(wallet.getId());
            }
        }
        log.debug("Updated label of wallet {}", id);
        return walletRepository.findById(id)
            .map(WalletEntity::toDomain)
            .orElseThrow(() -> new WalletNotFoundException(wallet.getId()));
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<Wallet> findWalletById(WalletId walletId) {
        return walletRepository.findById(walletId.getValue())
            .map(WalletEntity::toDomain);
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<Wallet> findActiveWalletById(WalletId walletId) {
        return walletRepository.findByIdAndActiveTrue(walletId.getValue())
            .map(WalletEntity::toDomain);
    }

    @Override
    @Transactional(readOnly = true)
    public boolean walletExists(WalletId walletId) {
        return walletRepository.existsById(walletId.getValue());
    }

    @Override
    @Transactional(readOnly = true)
    public List<Wallet> findWalletsByIds(Collection<WalletId> walletIds) {
        if (walletIds.isEmpty()) {
            return List.of();
        }
        return walletRepository.findAllById(toUuids(walletIds))
            .stream()
            .map(WalletEntity::toDomain)
            .toList();
    }

    @Override
    @Transactional(readOnly = true)
    public PageResult<Wallet> findWallets(WalletFilter filter, PageQuery pageQuery) {
        Specification<WalletEntity> specification = walletSpecification(filter);
        Sort sort = SortResolver.WALLETS.resolve(pageQuery.getOrdering());
        Page<WalletEntity> page = fetchPage(
            pageable -> walletRepository.findAll(specification, pageable), pageQuery, sort);
        return toPageResult(page, WalletEntity::toDomain);
    }

    // ==================== Transactions ====================

    @Override
    @Transactional(readOnly = true)
    public Optional<Transaction> findTransactionById(TransactionId transactionId) {
        return transactionRepository.findById(transactionId.getValue())
            .map(TransactionEntity::toDomain);
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<Transaction> findTransactionByTxId(TxId txid) {
        return transactionRepository.findByTxid(txid.getValue())
            .map(TransactionEntity::toDomain);
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<Transaction> findActiveTransactionByTxId(TxId txid) {
        return transactionRepository.findByTxidAndActiveTrue(txid.getValue())
            .map(TransactionEntity::toDomain);
    }

    @Override
    @Transactional(readOnly = true)
    public boolean transactionExistsByTxId(TxId txid) {
        return transactionRepository.existsByTxid(txid.getValue());
    }

    @Override
    @Transactional(readOnly = true)
    public List<Transaction> findActiveTransactionsByWalletId(WalletId walletId) {
        return transactionRepository.findByWalletIdAndActiveTrueOrderByCreatedAtAscIdAsc(walletId.getValue())
            .stream()
            .map(TransactionEntity::toDomain)
            .toList();
    }

    @Override
    @Transactional(readOnly = true)
    public List<Transaction> findActiveTransactionsByWalletIds(Collection<WalletId> walletIds) {
        if (walletIds.isEmpty()) {
            return List.of();
        }
        return transactionRepository.findByWalletIdInAndActiveTrueOrderByCreatedAtAscIdAsc(toUuids(walletIds))
            .stream()
            .map(TransactionEntity::toDomain)
            .toList();
    }

    @Override
    @Transactional(readOnly = true)
    public PageResult<Transaction> findTransactions(TransactionFilter filter, PageQuery pageQuery) {
        Specification<TransactionEntity> specification = transactionSpecification(filter);
        Sort sort = SortResolver.TRANSACTIONS.resolve(pageQuery.getOrdering());
        Page<TransactionEntity> page = fetchPage(
            pageable -> transactionRepository.findAll(specification, pageable), pageQuery, sort);
        return toPageResult(page, TransactionEntity::toDomain);
    }

    // ==================== Atomic protocols ====================

    /**
     * Locks the wallet row, re-reads the balance, validates the result and
     * writes the transaction plus the new balance in the same database
     * transaction. The in-memory balance of {@code wallet} plays no part.
     */
    @Override
    @Transactional
    public TransactionPosting createTransactionWithBalanceUpdate(Wallet wallet, Transaction transaction) {
        if (!wallet.getId().equals(transaction.getWalletId())) {
            throw new ValidationException(
                String.format("Transaction %s belongs to wallet %s, not %s",
                    transaction.getTxid(), transaction.getWalletId(), wallet.getId()));
        }
        if (!transaction.isActive()) {
            throw AlreadyDeactivatedException.transaction(transaction.getTxid());
        }

        WalletEntity locked = lockWallet(wallet.getId());
        if (!locked.isActive()) {
            throw AlreadyDeactivatedException.walletRejectsTransactions(wallet.getId());
        }

        Money currentBalance = locked.currentBalance();
        Money newBalance = currentBalance.plus(transaction.getAmount());
        if (newBalance.isNegative()) {
            log.warn("Rejected transaction {} on wallet {}: current={}, amount={}, resulting={}",
                transaction.getTxid(), wallet.getId(), currentBalance, transaction.getAmount(), newBalance);
            throw new InsufficientBalanceException(wallet.getId(), currentBalance, transaction.getAmount(), newBalance);
        }

        locked.applyBalance(newBalance);
        TransactionEntity saved = insertTransaction(transaction);

        log.debug("Posted transaction {} on wallet {}: balance {} -> {}",
            saved.getTxid(), wallet.getId(), currentBalance, newBalance);
        return new TransactionPosting(saved.toDomain(), locked.toDomain());
    }

    /**
     * Locks the wallet row and then every active transaction row of the
     * wallet, deactivates all of them with one timestamp and subtracts their sum
     * from the balance. The transactions are read here, under the lock, never
     * taken from a caller's possibly stale snapshot, so none can be missed.
     */
    @Override
    @Transactional
    public WalletDeactivation deactivateWalletWithTransactions(WalletId walletId) {
        WalletEntity locked = lockWallet(walletId);
        if (!locked.isActive()) {
            throw AlreadyDeactivatedException.wallet(walletId);
        }

        List<TransactionEntity> activeTransactions = lockActiveTransactions(walletId);

        Instant deactivatedAt = Timestamps.now();
        Money deactivatedTotal = Money.ZERO;
        for (TransactionEntity transaction : activeTransactions) {
            transaction.markDeactivated(deactivatedAt);
            deactivatedTotal = deactivatedTotal.plus(transaction.signedAmount());
        }

        Money remaining = locked.currentBalance().minus(deactivatedTotal);
        if (!remaining.isZero()) {
            log.error("Balance drift on wallet {}: balance={}, active total={}, remaining after cascade={}",
                walletId, locked.currentBalance(), deactivatedTotal, remaining);
        }
        locked.applyBalance(remaining);
        locked.markDeactivated(deactivatedAt);

        WalletEntity saved = walletRepository.saveAndFlush(locked);

        log.debug("Deactivated wallet {} with {} transactions, total {}",
            walletId, activeTransactions.size(), deactivatedTotal);
        return new WalletDeactivation(
            saved.toDomain(),
            activeTransactions.stream().map(TransactionEntity::toDomain).toList(),
            deactivatedTotal
        );
    }

    // ==================== Helpers ====================

    private WalletEntity lockWallet(WalletId walletId) {
        applyLockTimeout();
        try {
            return walletRepository.findByIdForUpdate(walletId.getValue())
                .orElseThrow(() -> new WalletNotFoundException(walletId));
        } catch (PessimisticLockingFailureException e) {
            log.warn("Lock on wallet {} not acquired within {}: {}", walletId, lockTimeout, e.getMessage());
            throw new LockTimeoutException(walletId, e);
        }
    }

    private List<TransactionEntity> lockActiveTransactions(WalletId walletId) {
        try {
            return transactionRepository.findActiveByWalletIdForUpdate(walletId.getValue());
        } catch (PessimisticLockingFailureException e) {
            log.warn("Transaction locks of wallet {} not acquired within {}: {}",
                walletId, lockTimeout, e.getMessage());
            throw new LockTimeoutException(walletId, e);
        }
    }

    /**
     * Bounds lock waits for the rest of the current database transaction
     * (is_local = true).
     */
    private void applyLockTimeout() {
        jdbcTemplate.queryForObject(
            "SELECT set_config('lock_timeout', ?, true)",
            String.class,
            lockTimeout.toMillis() + "ms"
        );
    }

    private TransactionEntity insertTransaction(Transaction transaction) {
        try {
            return transactionRepository.saveAndFlush(TransactionEntity.fromDomain(transaction));
        } catch (DataIntegrityViolationException e) {
            String reason = e.getMostSpecificCause().getMessage();
            if (reason != null && reason.contains(TransactionEntity.TXID_CONSTRAINT)) {
                throw ConflictException.duplicateTxId(transaction.getTxid().getValue(), e);
            }
            throw e;
        }
    }

    private static <E> Page<E> fetchPage(Function<Pageable, Page<E>> query, PageQuery pageQuery, Sort sort) {
        Page<E> page = query.apply(PageRequest.of(pageQuery.getPage() - 1, pageQuery.getPageSize(), sort));
        // Out-of-range page numbers deliver the last page; an empty result is page 1.
        int lastPage = Math.max(1, page.getTotalPages());
        if (pageQuery.getPage() > lastPage) {
            page = query.apply(PageRequest.of(lastPage - 1, pageQuery.getPageSize(), sort));
        }
        return page;
    }

    private static <E, T> PageResult<T> toPageResult(Page<E> page, Function<E, T> mapper) {
        return new PageResult<>(
            page.getContent().stream().map(mapper).toList(),
            page.getTotalElements(),
            page.getNumber() + 1,
            page.getSize(),
            Math.max(1, page.getTotalPages())
        );
    }

    private static Specification<WalletEntity> walletSpecification(WalletFilter filter) {
        return (root, query, cb) -> {
            List<Predicate> predicates = new ArrayList<>();
            if (filter.getActive() != null) {
                predicates.add(cb.equal(root.get("active"), filter.getActive()));
            }
            if (!filter.getWalletIds().isEmpty()) {
                predicates.add(root.get("id").in(toUuids(filter.getWalletIds())));
            }
            return cb.and(predicates.toArray(new Predicate[0]));
        };
    }

    private static Specification<TransactionEntity> transactionSpecification(TransactionFilter filter) {
        return (root, query, cb) -> {
            List<Predicate> predicates = new ArrayList<>();
            if (filter.getActive() != null) {
                predicates.add(cb.equal(root.get("active"), filter.getActive()));
            }
            if (!filter.getWalletIds().isEmpty()) {
                predicates.add(root.get("walletId").in(toUuids(filter.getWalletIds())));
            }
            return cb.and(predicates.toArray(new Predicate[0]));
        };
    }

    private static List<UUID> toUuids(Collection<WalletId> walletIds) {
        return walletIds.stream()
            .map(WalletId::getValue)
            .toList();
    }
}
