package com.flagship.wallet_ledger.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class UpdateWalletLabelRequest {

    @NotBlank(message = "Label is required")
    @Size(max = 255, message = "Label cannot exceed 255 characters")
    @JsonProperty("label")
    private String label;
}
