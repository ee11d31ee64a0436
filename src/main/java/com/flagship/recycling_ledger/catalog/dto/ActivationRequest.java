package com.flagship.recycling_ledger.catalog.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotNull;
import lombok.Value;

@Value
public class ActivationRequest {

    @NotNull(message = "is_active is required")
    @JsonProperty("is_active")
    Boolean active;
}
