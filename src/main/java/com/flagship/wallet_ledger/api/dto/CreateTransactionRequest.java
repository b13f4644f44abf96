package com.flagship.wallet_ledger.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.util.UUID;

/**
 * Request DTO for posting a transaction.
 *
 * A positive amount credits the wallet, a negative amount debits it. The txid
 * is always generated by the server.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class CreateTransactionRequest {

    @NotNull(message = "Wallet ID is required")
    @JsonProperty("wallet_id")
    private UUID walletId;

    @NotNull(message = "Amount is required")
    @JsonProperty("amount")
    private BigDecimal amount;
}
