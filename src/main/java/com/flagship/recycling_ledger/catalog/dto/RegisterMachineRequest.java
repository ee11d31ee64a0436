package com.flagship.recycling_ledger.catalog.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.Value;

import java.math.BigDecimal;

@Value
public class RegisterMachineRequest {

    @NotBlank(message = "Machine id is required")
    @Size(max = 20, message = "Machine id must be at most 20 characters")
    @JsonProperty("machine_id")
    String machineId;

    @NotBlank(message = "Location is required")
    @Size(max = 200, message = "Location must be at most 200 characters")
    @JsonProperty("location")
    String location;

    @JsonProperty("latitude")
    BigDecimal latitude;

    @JsonProperty("longitude")
    BigDecimal longitude;
}
