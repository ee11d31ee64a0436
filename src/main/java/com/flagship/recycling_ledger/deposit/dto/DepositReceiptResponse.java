package com.flagship.recycling_ledger.deposit.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.recycling_ledger.deposit.DepositReceipt;
import com.flagship.recycling_ledger.totals.dto.UserTotalsResponse;
import lombok.Value;

@Value
public class DepositReceiptResponse {

    @JsonProperty("deposit")
    DepositResponse deposit;

    @JsonProperty("totals")
    UserTotalsResponse totals;

    public static DepositReceiptResponse from(DepositReceipt receipt) {
        return new DepositReceiptResponse(
            DepositResponse.from(receipt.getDeposit()),
            UserTotalsResponse.from(receipt.getTotals()));
    }
}
