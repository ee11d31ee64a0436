package com.flagship.recycling_ledger.totals.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.recycling_ledger.totals.UserTotals;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

@Value
@Builder
public class UserTotalsResponse {

    @JsonProperty("user_id")
    UUID userId;

    @JsonProperty("total_points")
    BigDecimal totalPoints;

    @JsonProperty("total_weight_kg")
    BigDecimal totalWeightKg;

    @JsonProperty("deposit_count")
    long depositCount;

    @JsonProperty("updated_at")
    Instant updatedAt;

    @JsonProperty("rebuilt_at")
    Instant rebuiltAt;

    public static UserTotalsResponse from(UserTotals totals) {
        return UserTotalsResponse.builder()
            .userId(totals.getUserId())
            .totalPoints(totals.getTotalPoints())
            .totalWeightKg(totals.getTotalWeightKg())
            .depositCount(totals.getDepositCount())
            .updatedAt(totals.getUpdatedAt())
            .rebuiltAt(totals.getRebuiltAt())
            .build();
    }
}
