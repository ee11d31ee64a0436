package com.flagship.recycling_ledger.catalog.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.recycling_ledger.catalog.Material;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.util.UUID;

@Value
@Builder
public class MaterialResponse {

    @JsonProperty("id")
    UUID id;

    @JsonProperty("name")
    String name;

    @JsonProperty("points_per_kg")
    BigDecimal pointsPerKg;

    @JsonProperty("description")
    String description;

    @JsonProperty("is_active")
    boolean active;

    public static MaterialResponse from(Material material) {
        return MaterialResponse.builder()
            .id(material.getId())
            .name(material.getName())
            .pointsPerKg(material.getPointsPerKg())
            .description(material.getDescription())
            .active(material.isActive())
            .build();
    }
}
