package com.flagship.recycling_ledger.catalog;

import lombok.Value;

import java.math.BigDecimal;
import java.util.UUID;

/**
 * A recyclable material and the reward rate paid per kilogram.
 *
 * The rate is read at deposit time and frozen into the ledger entry, so changing
 * it later never touches existing deposits.
 */
@Value
public class Material {
    UUID id;
    String name;
    BigDecimal pointsPerKg;
    String description;
    boolean active;
}
