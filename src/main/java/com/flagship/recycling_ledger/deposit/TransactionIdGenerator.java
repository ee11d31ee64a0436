package com.flagship.recycling_ledger.deposit;

import org.springframework.stereotype.Component;

import java.security.SecureRandom;
import java.util.HexFormat;

/**
 * Generates deposit transaction IDs: "TXN-" followed by 96 random bits
 * rendered as 24 upper-case hex characters.
 */
@Component
public class TransactionIdGenerator {

    static final String PREFIX = "TXN-";
    private static final int RANDOM_BYTES = 12;

    private final SecureRandom random = new SecureRandom();

    public String next() {
        byte[] bytes = new byte[RANDOM_BYTES];
        random.nextBytes(bytes);
        return PREFIX + HexFormat.of().withUpperCase().formatHex(bytes);
    }
}
