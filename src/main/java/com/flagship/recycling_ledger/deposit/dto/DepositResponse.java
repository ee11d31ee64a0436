package com.flagship.recycling_ledger.deposit.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.recycling_ledger.deposit.Deposit;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

@Value
@Builder
public class DepositResponse {

    @JsonProperty("id")
    UUID id;

    @JsonProperty("transaction_id")
    String transactionId;

    @JsonProperty("user_id")
    UUID userId;

    @JsonProperty("machine_id")
    String machineId;

    @JsonProperty("material_type")
    String materialType;

    @JsonProperty("weight_kg")
    BigDecimal weightKg;

    @JsonProperty("points_per_kg")
    BigDecimal pointsPerKg;

    @JsonProperty("points_earned")
    BigDecimal pointsEarned;

    @JsonProperty("notes")
    String notes;

    @JsonProperty("created_at")
    Instant createdAt;

    public static DepositResponse from(Deposit deposit) {
        return DepositResponse.builder()
            .id(deposit.getId())
            .transactionId(deposit.getTransactionId())
            .userId(deposit.getUserId())
            .machineId(deposit.getMachineCode())
            .materialType(deposit.getMaterialName())
            .weightKg(deposit.getWeightKg())
            .pointsPerKg(deposit.getPointsPerKg())
            .pointsEarned(deposit.getPointsEarned())
            .notes(deposit.getNotes())
            .createdAt(deposit.getCreatedAt())
            .build();
    }
}
