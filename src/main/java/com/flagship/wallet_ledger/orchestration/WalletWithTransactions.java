package com.flagship.wallet_ledger.orchestration;

import com.flagship.wallet_ledger.shared.Money;
import com.flagship.wallet_ledger.transaction.Transaction;
import com.flagship.wallet_ledger.wallet.Wallet;
import lombok.Value;

import java.util.List;

/**
 * An active wallet together with its active transactions, oldest first.
 */
@Value
public class WalletWithTransactions {
    Wallet wallet;
    List<Transaction> transactions;

    public Money transactionTotal() {
        return transactions.stream()
            .map(Transaction::getAmount)
            .reduce(Money.ZERO, Money::plus);
    }
}
