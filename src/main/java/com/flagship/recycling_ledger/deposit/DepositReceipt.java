package com.flagship.recycling_ledger.deposit;

import com.flagship.recycling_ledger.totals.UserTotals;
import lombok.Value;

/**
 * The accepted ledger entry together with the user's totals right after it.
 */
@Value
public class DepositReceipt {
    Deposit deposit;
    UserTotals totals;
}
