package com.flagship.recycling_ledger.deposit.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.Value;

import java.math.BigDecimal;

/**
 * Deposit submission from a machine. Weight bounds are checked by the deposit
 * guard so that they surface as INVALID_WEIGHT.
 */
@Value
public class CreateDepositRequest {

    @NotBlank(message = "Machine ID is required")
    @JsonProperty("machine_id")
    String machineId;

    @NotBlank(message = "Material type is required")
    @JsonProperty("material_type")
    String materialType;

    @NotNull(message = "Weight is required")
    @JsonProperty("weight_kg")
    BigDecimal weightKg;

    @Size(max = 500, message = "Notes must be at most 500 characters")
    @JsonProperty("notes")
    String notes;
}
