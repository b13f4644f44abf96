package com.flagship.wallet_ledger.wallet;

import com.flagship.wallet_ledger.shared.FilterParsing;
import com.flagship.wallet_ledger.shared.WalletId;
import lombok.Value;

import java.util.Collection;
import java.util.Set;

/**
 * Wallet listing filter. A null {@code active} and an empty ID set both mean
 * "no restriction".
 */
@Value
public class WalletFilter {
    Boolean active;
    Set<WalletId> walletIds;

    private WalletFilter(Boolean active, Collection<WalletId> walletIds) {
        this.active = active;
        this.walletIds = walletIds == null ? Set.of() : Set.copyOf(walletIds);
    }

    public static WalletFilter of(Boolean active, Collection<WalletId> walletIds) {
        return new WalletFilter(active, walletIds);
    }

    public static WalletFilter all() {
        return new WalletFilter(null, null);
    }

    public static WalletFilter activeOnly() {
        return new WalletFilter(Boolean.TRUE, null);
    }

    /**
     * Builds a filter from raw API parameters.
     */
    public static WalletFilter parse(String isActive, Collection<String> walletIds) {
        return new WalletFilter(FilterParsing.parseActiveFlag(isActive), FilterParsing.parseWalletIds(walletIds));
    }
}
