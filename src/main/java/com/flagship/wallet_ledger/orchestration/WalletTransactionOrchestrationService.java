package com.flagship.wallet_ledger.orchestration;

import com.flagship.wallet_ledger.ledger.LedgerStore;
import com.flagship.wallet_ledger.ledger.TransactionPosting;
import com.flagship.wallet_ledger.ledger.WalletDeactivation;
import com.flagship.wallet_ledger.observability.CorrelationContext;
import com.flagship.wallet_ledger.observability.LedgerMetrics;
import com.flagship.wallet_ledger.shared.Money;
import com.flagship.wallet_ledger.shared.WalletId;
import com.flagship.wallet_ledger.shared.exception.AlreadyDeactivatedException;
import com.flagship.wallet_ledger.shared.exception.LedgerException;
import com.flagship.wallet_ledger.transaction.Transaction;
import com.flagship.wallet_ledger.transaction.TransactionDomainService;
import com.flagship.wallet_ledger.wallet.Wallet;
import com.flagship.wallet_ledger.wallet.WalletDomainService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.util.List;

/**
 * Use cases spanning a wallet and its transactions.
 *
 * Key principles:
 * - Balance changes happen only inside the store's locked protocols
 * - The in-memory wallet is a snapshot; its balance is never persisted from here
 * - Errors propagate unchanged; nothing is retried automatically
 */
@RequiredArgsConstructor
@Slf4j
public class WalletTransactionOrchestrationService {

    private final WalletDomainService walletService;
    private final TransactionDomainService transactionService;
    private final LedgerStore store;
    private final LedgerMetrics metrics;

    /**
     * Posts a credit (positive amount) or debit (negative amount) to a wallet.
     *
     * The wallet lookup fails fast on a missing or inactive wallet before any
     * lock is taken. The store then re-validates everything under the wallet
     * row lock.
     *
     * @return the persisted transaction and the wallet with its authoritative balance
     * @throws com.flagship.wallet_ledger.shared.exception.WalletNotFoundException if the wallet does not exist
     * @throws AlreadyDeactivatedException if the wallet is inactive
     * @throws com.flagship.wallet_ledger.shared.exception.InsufficientBalanceException if the balance would go negative
     * @throws com.flagship.wallet_ledger.shared.exception.LockTimeoutException if the wallet stayed locked too long
     */
    public TransactionPosting createTransactionWithBalanceUpdate(WalletId walletId, Money amount) {
        long startTime = System.currentTimeMillis();
        CorrelationContext.enterWallet(walletId);

        try {
            Wallet wallet = walletService.getWalletAnyState(walletId);
            if (!wallet.isActive()) {
                throw AlreadyDeactivatedException.walletRejectsTransactions(walletId);
            }

            Transaction transaction = transactionService.createTransaction(walletId, amount);
            wallet.addTransaction(transaction);

            TransactionPosting posting = store.createTransactionWithBalanceUpdate(wallet, transaction);

            long duration = System.currentTimeMillis() - startTime;
            metrics.recordTransactionCreated(transaction.isCredit());
            log.info("Transaction posted: txid={}, amount={}, balance={}, duration={}ms",
                posting.getTransaction().getTxid(), amount, posting.getWallet().getBalance(), duration);
            return posting;

        } catch (LedgerException e) {
            metrics.recordTransactionRejected(e.getKind().name());
            log.warn("Transaction rejected: kind={}, amount={}, message={}", e.getKind(), amount, e.getMessage());
            throw e;
        } finally {
            metrics.recordOperationLatency("create_transaction", System.currentTimeMillis() - startTime);
            CorrelationContext.exitWallet();
        }
    }

    /**
     * Deactivates a wallet and every one of its active transactions atomically.
     *
     * The transactions are discovered and locked by the store inside the same
     * unit; they are not enumerated here.
     *
     * @throws com.flagship.wallet_ledger.shared.exception.WalletNotFoundException if the wallet does not exist
     * @throws AlreadyDeactivatedException if the wallet is already inactive
     */
    public WalletDeactivation deactivateWalletWithTransactions(WalletId walletId) {
        long startTime = System.currentTimeMillis();
        CorrelationContext.enterWallet(walletId);

        try {
            WalletDeactivation deactivation = walletService.deactivateWallet(walletId);
            metrics.incrementWalletsDeactivated();
            return deactivation;

        } catch (LedgerException e) {
            log.warn("Wallet deactivation rejected: kind={}, message={}", e.getKind(), e.getMessage());
            throw e;
        } finally {
            metrics.recordOperationLatency("deactivate_wallet", System.currentTimeMillis() - startTime);
            CorrelationContext.exitWallet();
        }
    }

    /**
     * @throws com.flagship.wallet_ledger.shared.exception.WalletNotFoundException if the wallet does not exist or is inactive
     */
    public WalletWithTransactions getWalletWithTransactions(WalletId walletId) {
        Wallet wallet = walletService.getWallet(walletId);
        List<Transaction> transactions = transactionService.getTransactionsByWalletId(walletId);
        return new WalletWithTransactions(wallet, transactions);
    }
}
