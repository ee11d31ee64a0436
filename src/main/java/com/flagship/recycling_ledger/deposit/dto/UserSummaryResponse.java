package com.flagship.recycling_ledger.deposit.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.recycling_ledger.deposit.UserSummary;
import com.flagship.recycling_ledger.totals.dto.UserTotalsResponse;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.util.List;

@Value
@Builder
public class UserSummaryResponse {

    @JsonProperty("totals")
    UserTotalsResponse totals;

    @JsonProperty("last_30_days")
    PeriodStatsResponse last30Days;

    @JsonProperty("material_breakdown")
    List<MaterialBreakdownResponse> materialBreakdown;

    @JsonProperty("favorite_material")
    String favoriteMaterial;

    @JsonProperty("recent_deposits")
    List<DepositResponse> recentDeposits;

    @JsonProperty("rank")
    long rank;

    @Value
    public static class PeriodStatsResponse {
        @JsonProperty("points")
        BigDecimal points;

        @JsonProperty("weight_kg")
        BigDecimal weightKg;

        @JsonProperty("deposit_count")
        long depositCount;
    }

    @Value
    public static class MaterialBreakdownResponse {
        @JsonProperty("material_type")
        String materialType;

        @JsonProperty("weight_kg")
        BigDecimal weightKg;

        @JsonProperty("points")
        BigDecimal points;

        @JsonProperty("deposit_count")
        long depositCount;
    }

    public static UserSummaryResponse from(UserSummary summary) {
        UserSummary.PeriodStats recent = summary.getLast30Days();
        return UserSummaryResponse.builder()
            .totals(UserTotalsResponse.from(summary.getTotals()))
            .last30Days(new PeriodStatsResponse(recent.getPoints(), recent.getWeightKg(), recent.getDepositCount()))
            .materialBreakdown(summary.getMaterialBreakdown().stream()
                .map(m -> new MaterialBreakdownResponse(
                    m.getMaterialName(), m.getWeightKg(), m.getPoints(), m.getDepositCount()))
                .toList())
            .favoriteMaterial(summary.getFavoriteMaterial())
            .recentDeposits(summary.getRecentDeposits().stream().map(DepositResponse::from).toList())
            .rank(summary.getRank())
            .build();
    }
}
