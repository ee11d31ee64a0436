package com.flagship.recycling_ledger.deposit;

import lombok.Value;

import java.math.BigDecimal;
import java.util.UUID;

/**
 * A raw deposit submission. The user ID comes from the authenticated caller,
 * the rest from the machine.
 */
@Value
public class DepositCommand {
    UUID userId;
    String machineCode;
    String materialName;
    BigDecimal weightKg;
    String notes;
}
