package com.flagship.recycling_ledger.catalog.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.Value;

import java.math.BigDecimal;

@Value
public class RegisterMaterialRequest {

    @NotBlank(message = "Material name is required")
    @Size(max = 50, message = "Material name must be at most 50 characters")
    @JsonProperty("name")
    String name;

    @NotNull(message = "Points per kg is required")
    @DecimalMin(value = "0.01", message = "Points per kg must be at least 0.01")
    @JsonProperty("points_per_kg")
    BigDecimal pointsPerKg;

    @JsonProperty("description")
    String description;
}
