package com.flagship.wallet_ledger.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.wallet_ledger.ledger.WalletDeactivation;
import lombok.Value;

import java.math.BigDecimal;

@Value
public class WalletDeactivationResponse {

    @JsonProperty("wallet")
    WalletResponse wallet;

    @JsonProperty("deactivated_transactions")
    int deactivatedTransactions;

    @JsonProperty("deactivated_total")
    BigDecimal deactivatedTotal;

    public static WalletDeactivationResponse from(WalletDeactivation deactivation) {
        return new WalletDeactivationResponse(
            WalletResponse.from(deactivation.getWallet()),
            deactivation.getDeactivatedTransactions().size(),
            deactivation.getDeactivatedTotal().getAmount()
        );
    }
}
