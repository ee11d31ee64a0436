package com.flagship.recycling_ledger.deposit;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.HashSet;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class TransactionIdGeneratorTest {

    private final TransactionIdGenerator generator = new TransactionIdGenerator();

    @Test
    @DisplayName("IDs are TXN- followed by 24 upper-case hex characters")
    void next_hasExpectedShape() {
        String id = generator.next();

        assertTrue(id.matches("^TXN-[0-9A-F]{24}$"), "Unexpected transaction id: " + id);
    }

    @Test
    @DisplayName("IDs do not repeat")
    void next_isUnique() {
        Set<String> ids = new HashSet<>();
        for (int i = 0; i < 10_000; i++) {
            assertTrue(ids.add(generator.next()), "Duplicate transaction id generated");
        }
    }
}
