package com.flagship.recycling_ledger.catalog.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.recycling_ledger.catalog.Machine;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;

@Value
@Builder
public class MachineResponse {

    @JsonProperty("machine_id")
    String machineId;

    @JsonProperty("location")
    String location;

    @JsonProperty("latitude")
    BigDecimal latitude;

    @JsonProperty("longitude")
    BigDecimal longitude;

    @JsonProperty("is_active")
    boolean active;

    public static MachineResponse from(Machine machine) {
        return MachineResponse.builder()
            .machineId(machine.getMachineCode())
            .location(machine.getLocation())
            .latitude(machine.getLatitude())
            .longitude(machine.getLongitude())
            .active(machine.isActive())
            .build();
    }
}
