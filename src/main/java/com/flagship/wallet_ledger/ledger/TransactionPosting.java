package com.flagship.wallet_ledger.ledger;

import com.flagship.wallet_ledger.transaction.Transaction;
import com.flagship.wallet_ledger.wallet.Wallet;
import lombok.Value;

/**
 * Outcome of a committed balance-updating transaction: the persisted
 * transaction and the wallet carrying the balance written under the lock.
 */
@Value
public class TransactionPosting {
    Transaction transaction;
    Wallet wallet;
}
