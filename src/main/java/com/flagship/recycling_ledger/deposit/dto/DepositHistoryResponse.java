package com.flagship.recycling_ledger.deposit.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.recycling_ledger.deposit.Deposit;
import lombok.Builder;
import lombok.Value;
import org.springframework.data.domain.Page;

import java.util.List;

@Value
@Builder
public class DepositHistoryResponse {

    @JsonProperty("deposits")
    List<DepositResponse> deposits;

    @JsonProperty("page")
    int page;

    @JsonProperty("page_size")
    int pageSize;

    @JsonProperty("total_pages")
    int totalPages;

    @JsonProperty("total_count")
    long totalCount;

    public static DepositHistoryResponse from(Page<Deposit> page) {
        return DepositHistoryResponse.builder()
            .deposits(page.getContent().stream().map(DepositResponse::from).toList())
            .page(page.getNumber())
            .pageSize(page.getSize())
            .totalPages(page.getTotalPages())
            .totalCount(page.getTotalElements())
            .build();
    }
}
