package com.flagship.wallet_ledger.transaction;

import com.flagship.wallet_ledger.shared.FilterParsing;
import com.flagship.wallet_ledger.shared.WalletId;
import lombok.Value;

import java.util.Collection;
import java.util.Set;

/**
 * Transaction listing filter. A null {@code active} and an empty wallet ID set
 * both mean "no restriction".
 */
@Value
public class TransactionFilter {
    Boolean active;
    Set<WalletId> walletIds;

    private TransactionFilter(Boolean active, Collection<WalletId> walletIds) {
        this.active = active;
        this.walletIds = walletIds == null ? Set.of() : Set.copyOf(walletIds);
    }

    public static TransactionFilter of(Boolean active, Collection<WalletId> walletIds) {
        return new TransactionFilter(active, walletIds);
    }

    public static TransactionFilter all() {
        return new TransactionFilter(null, null);
    }

    public static TransactionFilter forWallet(WalletId walletId) {
        return new TransactionFilter(null, Set.of(walletId));
    }

    public static TransactionFilter parse(String isActive, Collection<String> walletIds) {
        return new TransactionFilter(FilterParsing.parseActiveFlag(isActive), FilterParsing.parseWalletIds(walletIds));
    }
}
