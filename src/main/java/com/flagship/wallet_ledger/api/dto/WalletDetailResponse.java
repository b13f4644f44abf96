package com.flagship.wallet_ledger.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.wallet_ledger.orchestration.WalletWithTransactions;
import lombok.Value;

import java.util.List;

/**
 * A wallet with its active transactions.
 */
@Value
public class WalletDetailResponse {

    @JsonProperty("wallet")
    WalletResponse wallet;

    @JsonProperty("transactions")
    List<TransactionResponse> transactions;

    public static WalletDetailResponse from(WalletWithTransactions view) {
        return new WalletDetailResponse(
            WalletResponse.from(view.getWallet()),
            view.getTransactions().stream().map(TransactionResponse::from).toList()
        );
    }
}
