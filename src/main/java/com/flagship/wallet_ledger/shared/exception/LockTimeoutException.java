package com.flagship.wallet_ledger.shared.exception;

import com.flagship.wallet_ledger.shared.WalletId;

import java.util.Map;

/**
 * The wallet row lock could not be acquired in time.
 *
 * Safe to retry the whole use case, re-reading fresh state. The store never
 * retries on its own.
 */
public class LockTimeoutException extends LedgerException {

    public LockTimeoutException(WalletId walletId, Throwable cause) {
        super(ErrorKind.BUSY,
            "Wallet " + walletId + " is busy, lock could not be acquired",
            Map.of("wallet_id", walletId.toString()),
            cause);
    }
}
