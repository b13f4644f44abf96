package com.flagship.wallet_ledger.wallet;

import com.flagship.wallet_ledger.ledger.LedgerStore;
import com.flagship.wallet_ledger.ledger.WalletDeactivation;
import com.flagship.wallet_ledger.observability.LedgerMetrics;
import com.flagship.wallet_ledger.shared.PageQuery;
import com.flagship.wallet_ledger.shared.PageResult;
import com.flagship.wallet_ledger.shared.WalletId;
import com.flagship.wallet_ledger.shared.exception.AlreadyDeactivatedException;
import com.flagship.wallet_ledger.shared.exception.WalletNotFoundException;
import lombok.extern.slf4j.Slf4j;

import java.util.Collection;
import java.util.List;

/**
 * Wallet lookups, creation and label maintenance.
 *
 * Balance and activation state are never written from here; deactivation is
 * handed to the store's cascade protocol.
 */
@Slf4j
public class WalletDomainService {

    private final LedgerStore store;
    private final LedgerMetrics metrics;
    private final int maxPageSize;

    public WalletDomainService(LedgerStore store, LedgerMetrics metrics, int maxPageSize) {
        this.store = store;
        this.metrics = metrics;
        this.maxPageSize = maxPageSize;
    }

    /**
     * Creates and persists a new active wallet with a zero balance.
     */
    public Wallet createWallet(String label) {
        Wallet wallet = Wallet.create(WalletId.newId(), label);
        Wallet saved = store.insertWallet(wallet);
        metrics.incrementWalletsCreated();
        log.info("Wallet created: walletId={}, label={}", saved.getId(), saved.getLabel());
        return saved;
    }

    /**
     * @throws WalletNotFoundException if the wallet does not exist or is inactive
     */
    public Wallet getWallet(WalletId walletId) {
        return store.findActiveWalletById(walletId)
            .orElseThrow(() -> new WalletNotFoundException(walletId));
    }

    /**
     * @throws WalletNotFoundException if the wallet does not exist
     */
    public Wallet getWalletAnyState(WalletId walletId) {
        return store.findWalletById(walletId)
            .orElseThrow(() -> new WalletNotFoundException(walletId));
    }

    /**
     * @throws WalletNotFoundException if the wallet does not exist
     * @throws AlreadyDeactivatedException if the wallet is inactive
     */
    public Wallet updateLabel(WalletId walletId, String label) {
        Wallet wallet = getWalletAnyState(walletId);
        wallet.ensureActive();
        wallet.updateLabel(label);
        Wallet saved = store.updateWalletLabel(wallet);
        log.info("Wallet label updated: walletId={}, label={}", walletId, saved.getLabel());
        return saved;
    }

    /**
     * Deactivates the wallet and all of its active transactions in one unit.
     *
     * @throws WalletNotFoundException if the wallet does not exist
     * @throws AlreadyDeactivatedException if the wallet is already inactive
     */
    public WalletDeactivation deactivateWallet(WalletId walletId) {
        Wallet wallet = getWalletAnyState(walletId);
        wallet.ensureActive();
        WalletDeactivation deactivation = store.deactivateWalletWithTransactions(walletId);
        log.info("Wallet deactivated: walletId={}, transactions={}, total={}",
            walletId, deactivation.getDeactivatedTransactions().size(), deactivation.getDeactivatedTotal());
        return deactivation;
    }

    public List<Wallet> getWalletsByIds(Collection<WalletId> walletIds) {
        return store.findWalletsByIds(walletIds);
    }

    public PageResult<Wallet> listWallets(WalletFilter filter, PageQuery pageQuery) {
        return store.findWallets(filter, pageQuery.withMaxPageSize(maxPageSize));
    }
}
