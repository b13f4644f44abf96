package com.flagship.wallet_ledger.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.wallet_ledger.ledger.TransactionPosting;
import lombok.Value;

/**
 * The posted transaction and the wallet with its balance after the posting.
 */
@Value
public class TransactionPostingResponse {

    @JsonProperty("transaction")
    TransactionResponse transaction;

    @JsonProperty("wallet")
    WalletResponse wallet;

    public static TransactionPostingResponse from(TransactionPosting posting) {
        return new TransactionPostingResponse(
            TransactionResponse.from(posting.getTransaction()),
            WalletResponse.from(posting.getWallet())
        );
    }
}
