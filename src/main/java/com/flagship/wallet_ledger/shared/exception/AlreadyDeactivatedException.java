package com.flagship.wallet_ledger.shared.exception;

import java.util.Map;

/**
 * Raised on a second deactivation, or on any write to a deactivated wallet.
 */
public class AlreadyDeactivatedException extends LedgerException {

    private AlreadyDeactivatedException(String message, Map<String, Object> details) {
        super(ErrorKind.ALREADY_DEACTIVATED, message, details);
    }

    public static AlreadyDeactivatedException wallet(Object walletId) {
        return new AlreadyDeactivatedException(
            "Wallet " + walletId + " is already deactivated",
            Map.of("wallet_id", String.valueOf(walletId)));
    }

    public static AlreadyDeactivatedException walletRejectsTransactions(Object walletId) {
        return new AlreadyDeactivatedException(
            "Cannot add transaction to deactivated wallet " + walletId,
            Map.of("wallet_id", String.valueOf(walletId)));
    }

    public static AlreadyDeactivatedException transaction(Object txid) {
        return new AlreadyDeactivatedException(
            "Transaction " + txid + " is already deactivated",
            Map.of("txid", String.valueOf(txid)));
    }
}
