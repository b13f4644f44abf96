package com.flagship.wallet_ledger.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.wallet_ledger.transaction.Transaction;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * Response DTO for transaction operations.
 */
@Value
@Builder
public class TransactionResponse {

    @JsonProperty("id")
    UUID id;

    @JsonProperty("wallet_id")
    UUID walletId;

    @JsonProperty("txid")
    String txid;

    @JsonProperty("amount")
    BigDecimal amount;

    @JsonProperty("is_active")
    boolean active;

    @JsonProperty("deactivated_at")
    Instant deactivatedAt;

    @JsonProperty("created_at")
    Instant createdAt;

    @JsonProperty("updated_at")
    Instant updatedAt;

    public static TransactionResponse from(Transaction transaction) {
        return TransactionResponse.builder()
            .id(transaction.getId().getValue())
            .walletId(transaction.getWalletId().getValue())
            .txid(transaction.getTxid().getValue())
            .amount(transaction.getAmount().getAmount())
            .active(transaction.isActive())
            .deactivatedAt(transaction.getDeactivatedAt())
            .createdAt(transaction.getCreatedAt())
            .updatedAt(transaction.getUpdatedAt())
            .build();
    }
}
