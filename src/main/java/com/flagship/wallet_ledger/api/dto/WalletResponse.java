package com.flagship.wallet_ledger.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.wallet_ledger.wallet.Wallet;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * Response DTO for wallet operations.
 */
@Value
@Builder
public class WalletResponse {

    @JsonProperty("id")
    UUID id;

    @JsonProperty("label")
    String label;

    @JsonProperty("balance")
    BigDecimal balance;

    @JsonProperty("is_active")
    boolean active;

    @JsonProperty("deactivated_at")
    Instant deactivatedAt;

    @JsonProperty("created_at")
    Instant createdAt;

    @JsonProperty("updated_at")
    Instant updatedAt;

    public static WalletResponse from(Wallet wallet) {
        return WalletResponse.builder()
            .id(wallet.getId().getValue())
            .label(wallet.getLabel())
            .balance(wallet.getBalance().getAmount())
            .active(wallet.isActive())
            .deactivatedAt(wallet.getDeactivatedAt())
            .createdAt(wallet.getCreatedAt())
            .updatedAt(wallet.getUpdatedAt())
            .build();
    }
}
