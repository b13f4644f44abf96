package com.flagship.wallet_ledger.transaction;

import com.flagship.wallet_ledger.ledger.LedgerStore;
import com.flagship.wallet_ledger.shared.Money;
import com.flagship.wallet_ledger.shared.PageQuery;
import com.flagship.wallet_ledger.shared.PageResult;
import com.flagship.wallet_ledger.shared.TransactionId;
import com.flagship.wallet_ledger.shared.TxId;
import com.flagship.wallet_ledger.shared.WalletId;
import com.flagship.wallet_ledger.shared.exception.TransactionNotFoundException;
import com.flagship.wallet_ledger.shared.exception.ValidationException;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.util.Collection;
import java.util.List;
import java.util.Random;
import java.util.UUID;

/**
 * Transaction lookups and construction of new, not yet persisted transactions.
 *
 * Allocates the external txid: {@code tx_<epochMillis>_<1000-9999>}, checked
 * against the store. On a collision only the random suffix is regenerated, up
 * to the configured number of attempts; after that the id falls back to
 * {@code tx_} plus 16 hex characters of a random UUID. Id allocation never
 * takes the wallet lock; the unique constraint on txid remains the final word.
 */
@Slf4j
public class TransactionDomainService {

    public static final String TXID_PREFIX = "tx_";

    private final LedgerStore store;
    private final int maxTxIdAttempts;
    private final int maxPageSize;
    private final Clock clock;
    private final Random random;

    public TransactionDomainService(LedgerStore store, int maxTxIdAttempts, int maxPageSize) {
        this(store, maxTxIdAttempts, maxPageSize, Clock.systemUTC(), new Random());
    }

    TransactionDomainService(LedgerStore store, int maxTxIdAttempts, int maxPageSize, Clock clock, Random random) {
        if (maxTxIdAttempts < 1) {
            throw new IllegalArgumentException("maxTxIdAttempts must be at least 1");
        }
        this.store = store;
        this.maxTxIdAttempts = maxTxIdAttempts;
        this.maxPageSize = maxPageSize;
        this.clock = clock;
        this.random = random;
    }

    /**
     * Builds a new active transaction with a unique txid. Nothing is persisted.
     *
     * @throws ValidationException if the amount is zero
     */
    public Transaction createTransaction(WalletId walletId, Money amount) {
        if (amount == null || amount.isZero()) {
            throw new ValidationException("Transaction amount cannot be zero");
        }
        TxId txid = generateUniqueTxId();
        return Transaction.create(TransactionId.newId(), walletId, txid, amount);
    }

    /**
     * Looks up an active transaction by its external id.
     *
     * @throws TransactionNotFoundException if no active transaction carries the txid
     */
    public Transaction getTransactionByTxId(String txid) {
        return store.findActiveTransactionByTxId(TxId.of(txid))
            .orElseThrow(() -> TransactionNotFoundException.byTxId(txid));
    }

    public List<Transaction> getTransactionsByWalletId(WalletId walletId) {
        return store.findActiveTransactionsByWalletId(walletId);
    }

    public List<Transaction> getTransactionsByWalletIds(Collection<WalletId> walletIds) {
        return store.findActiveTransactionsByWalletIds(walletIds);
    }

    public PageResult<Transaction> listTransactions(TransactionFilter filter, PageQuery pageQuery) {
        return store.findTransactions(filter, pageQuery.withMaxPageSize(maxPageSize));
    }

    public boolean existsByTxId(String txid) {
        return store.transactionExistsByTxId(TxId.of(txid));
    }

    TxId generateUniqueTxId() {
        long millis = clock.millis();
        for (int attempt = 1; attempt <= maxTxIdAttempts; attempt++) {
            TxId candidate = TxId.of(TXID_PREFIX + millis + "_" + (1000 + random.nextInt(9000)));
            if (!store.transactionExistsByTxId(candidate)) {
                return candidate;
            }
            log.debug("txid collision on attempt {}: {}", attempt, candidate);
        }
        TxId fallback = TxId.of(TXID_PREFIX + UUID.randomUUID().toString().replace("-", "").substring(0, 16));
        log.warn("txid generation collided {} times, falling back to {}", maxTxIdAttempts, fallback);
        return fallback;
    }
}
