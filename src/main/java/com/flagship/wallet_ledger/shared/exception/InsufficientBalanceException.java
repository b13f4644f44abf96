package com.flagship.wallet_ledger.shared.exception;

import com.flagship.wallet_ledger.shared.Money;
import com.flagship.wallet_ledger.shared.WalletId;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A transaction would leave the wallet with a negative balance.
 */
public class InsufficientBalanceException extends LedgerException {

    private final WalletId walletId;
    private final Money currentBalance;
    private final Money amount;
    private final Money resultingBalance;

    public InsufficientBalanceException(WalletId walletId, Money currentBalance, Money amount, Money resultingBalance) {
        super(ErrorKind.INSUFFICIENT_BALANCE,
            String.format("Transaction would result in negative balance. Current: %s, Transaction: %s, New Balance: %s",
                currentBalance, amount, resultingBalance),
            details(walletId, currentBalance, amount, resultingBalance));
        this.walletId = walletId;
        this.currentBalance = currentBalance;
        this.amount = amount;
        this.resultingBalance = resultingBalance;
    }

    private static Map<String, Object> details(WalletId walletId, Money current, Money amount, Money resulting) {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("wallet_id", walletId.toString());
        details.put("current_balance", current.toString());
        details.put("amount", amount.toString());
        details.put("resulting_balance", resulting.toString());
        return details;
    }

    public WalletId getWalletId() {
        return walletId;
    }

    public Money getCurrentBalance() {
        return currentBalance;
    }

    public Money getAmount() {
        return amount;
    }

    public Money getResultingBalance() {
        return resultingBalance;
    }
}
