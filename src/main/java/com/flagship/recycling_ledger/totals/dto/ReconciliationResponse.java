package com.flagship.recycling_ledger.totals.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.recycling_ledger.totals.ReconciliationReport;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

@Value
@Builder
public class ReconciliationResponse {

    @JsonProperty("drifted_users")
    List<UUID> driftedUsers;

    @JsonProperty("repaired_users")
    List<UUID> repairedUsers;

    @JsonProperty("failed_users")
    List<UUID> failedUsers;

    @JsonProperty("started_at")
    Instant startedAt;

    @JsonProperty("finished_at")
    Instant finishedAt;

    public static ReconciliationResponse from(ReconciliationReport report) {
        return ReconciliationResponse.builder()
            .driftedUsers(report.getDriftedUsers())
            .repairedUsers(report.getRepairedUsers())
            .failedUsers(report.getFailedUsers())
            .startedAt(report.getStartedAt())
            .finishedAt(report.getFinishedAt())
            .build();
    }
}
