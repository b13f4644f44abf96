package com.flagship.wallet_ledger.shared.exception;

import com.flagship.wallet_ledger.shared.WalletId;

import java.util.Map;

public class WalletNotFoundException extends NotFoundException {

    private final WalletId walletId;

    public WalletNotFoundException(WalletId walletId) {
        super("Wallet with ID " + walletId + " not found", Map.of("wallet_id", walletId.toString()));
        this.walletId = walletId;
    }

    public WalletId getWalletId() {
        return walletId;
    }
}
