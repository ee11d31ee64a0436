package com.flagship.recycling_ledger.catalog;

import lombok.Value;

import java.math.BigDecimal;
import java.util.UUID;

/**
 * A deployed reverse vending machine.
 * {@code machineCode} is the public identifier printed on the machine (e.g. RVM-001).
 */
@Value
public class Machine {
    UUID id;
    String machineCode;
    String location;
    BigDecimal latitude;
    BigDecimal longitude;
    boolean active;
}
