package com.flagship.recycling_ledger.deposit;

import com.flagship.recycling_ledger.deposit.dto.CreateDepositRequest;
import com.flagship.recycling_ledger.deposit.dto.DepositHistoryResponse;
import com.flagship.recycling_ledger.deposit.dto.DepositReceiptResponse;
import com.flagship.recycling_ledger.deposit.dto.UserSummaryResponse;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.LocalDate;
import java.util.UUID;

/**
 * Deposit endpoints.
 *
 * The caller's identity arrives in the X-User-Id header, set by the upstream
 * gateway after authentication; this service never checks credentials.
 */
@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
@Slf4j
public class DepositController {

    static final String USER_ID_HEADER = "X-User-Id";

    private final DepositLedgerService ledgerService;
    private final DepositQueryService queryService;

    @PostMapping("/deposits")
    public ResponseEntity<DepositReceiptResponse> createDeposit(
            @RequestHeader(USER_ID_HEADER) UUID userId,
            @Valid @RequestBody CreateDepositRequest request) {

        log.info("Received deposit: machine={}, material={}, weightKg={}",
            request.getMachineId(), request.getMaterialType(), request.getWeightKg());

        DepositReceipt receipt = ledgerService.createDeposit(new DepositCommand(
            userId,
            request.getMachineId(),
            request.getMaterialType(),
            request.getWeightKg(),
            request.getNotes()
        ));

        return ResponseEntity.status(HttpStatus.CREATED).body(DepositReceiptResponse.from(receipt));
    }

    @GetMapping("/deposits")
    public DepositHistoryResponse history(
            @RequestHeader(USER_ID_HEADER) UUID userId,
            @RequestParam(value = "page", defaultValue = "0") int page,
            @RequestParam(value = "material", required = false) String material,
            @RequestParam(value = "dateFrom", required = false)
            @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate dateFrom,
            @RequestParam(value = "dateTo", required = false)
            @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate dateTo) {

        return DepositHistoryResponse.from(queryService.history(userId, page, material, dateFrom, dateTo));
    }

    @GetMapping("/users/{userId}/summary")
    public UserSummaryResponse summary(@PathVariable("userId") UUID userId) {
        return UserSummaryResponse.from(queryService.summary(userId));
    }
}
