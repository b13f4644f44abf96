package com.flagship.wallet_ledger.ledger;

import com.flagship.wallet_ledger.shared.Money;
import com.flagship.wallet_ledger.transaction.Transaction;
import com.flagship.wallet_ledger.wallet.Wallet;
import lombok.Value;

import java.util.List;

/**
 * Outcome of a committed wallet deactivation cascade.
 */
@Value
public class WalletDeactivation {
    Wallet wallet;
    List<Transaction> deactivatedTransactions;

    /** Sum of the amounts removed from the wallet balance. */
    Money deactivatedTotal;
}
