package com.flagship.wallet_ledger.ledger;

import com.flagship.wallet_ledger.shared.PageQuery;
import com.flagship.wallet_ledger.shared.PageResult;
import com.flagship.wallet_ledger.shared.TransactionId;
import com.flagship.wallet_ledger.shared.TxId;
import com.flagship.wallet_ledger.shared.WalletId;
import com.flagship.wallet_ledger.transaction.Transaction;
import com.flagship.wallet_ledger.transaction.TransactionFilter;
import com.flagship.wallet_ledger.wallet.Wallet;
import com.flagship.wallet_ledger.wallet.WalletFilter;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Durable storage for wallets and transactions.
 *
 * The store is the only writer of wallet balance, activation state and
 * deactivation timestamps. Two operations carry transactional semantics:
 * <ul>
 *   <li>{@link #createTransactionWithBalanceUpdate} - insert a transaction and
 *       move the balance under the wallet row lock</li>
 *   <li>{@link #deactivateWalletWithTransactions} - deactivate a wallet and all
 *       of its active transactions under the same lock</li>
 * </ul>
 * Everything else is plain CRUD and querying. No method retries internally.
 */
public interface LedgerStore {

    // ==================== Wallets ====================

    /**
     * Inserts a new wallet as given (active, zero balance).
     */
    Wallet insertWallet(Wallet wallet);

    /**
     * Persists the label of an active wallet. No other column is written.
     *
     * @throws com.flagship.wallet_ledger.shared.exception.WalletNotFoundException if the wallet does not exist
     * @throws com.flagship.wallet_ledger.shared.exception.AlreadyDeactivatedException if it is inactive
     */
    Wallet updateWalletLabel(Wallet wallet);

    Optional<Wallet> findWalletById(WalletId walletId);

    Optional<Wallet> findActiveWalletById(WalletId walletId);

    boolean walletExists(WalletId walletId);

    List<Wallet> findWalletsByIds(Collection<WalletId> walletIds);

    PageResult<Wallet> findWallets(WalletFilter filter, PageQuery pageQuery);

    // ==================== Transactions ====================

    Optional<Transaction> findTransactionById(TransactionId transactionId);

    Optional<Transaction> findTransactionByTxId(TxId txid);

    Optional<Transaction> findActiveTransactionByTxId(TxId txid);

    boolean transactionExistsByTxId(TxId txid);

    List<Transaction> findActiveTransactionsByWalletId(WalletId walletId);

    List<Transaction> findActiveTransactionsByWalletIds(Collection<WalletId> walletIds);

    PageResult<Transaction> findTransactions(TransactionFilter filter, PageQuery pageQuery);

    // ==================== Atomic protocols ====================

    /**
     * Inserts {@code transaction} and adds its amount to the wallet balance, as
     * one unit.
     *
     * The wallet row is locked and its balance re-read from the database; the
     * in-memory balance of {@code wallet} is ignored.
     *
     * @throws com.flagship.wallet_ledger.shared.exception.InsufficientBalanceException if the new balance would be negative
     * @throws com.flagship.wallet_ledger.shared.exception.AlreadyDeactivatedException if the wallet was deactivated meanwhile
     * @throws com.flagship.wallet_ledger.shared.exception.WalletNotFoundException if the wallet does not exist
     * @throws com.flagship.wallet_ledger.shared.exception.LockTimeoutException if the lock is not acquired in time
     * @throws com.flagship.wallet_ledger.shared.exception.ConflictException if the txid is already taken
     */
    TransactionPosting createTransactionWithBalanceUpdate(Wallet wallet, Transaction transaction);

    /**
     * Deactivates the wallet and every one of its active transactions, removing
     * their amounts from the balance, as one unit.
     *
     * @throws com.flagship.wallet_ledger.shared.exception.WalletNotFoundException if the wallet does not exist
     * @throws com.flagship.wallet_ledger.shared.exception.AlreadyDeactivatedException if it is already inactive
     * @throws com.flagship.wallet_ledger.shared.exception.LockTimeoutException if the lock is not acquired in time
     */
    WalletDeactivation deactivateWalletWithTransactions(WalletId walletId);
}
