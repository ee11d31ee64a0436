package com.flagship.recycling_ledger.totals;

import com.flagship.recycling_ledger.totals.dto.ReconciliationResponse;
import com.flagship.recycling_ledger.totals.dto.UserTotalsResponse;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.UUID;

/**
 * Read access to user totals and the administrative rebuild, audit and
 * reconcile operations.
 */
@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
public class UserTotalsController {

    private final AggregateProjector projector;
    private final AggregateAuditService auditService;

    @GetMapping("/users/{userId}/totals")
    public UserTotalsResponse getTotals(@PathVariable("userId") UUID userId) {
        return UserTotalsResponse.from(projector.getTotals(userId));
    }

    @PostMapping("/admin/users/{userId}/totals/rebuild")
    public UserTotalsResponse rebuild(@PathVariable("userId") UUID userId) {
        return UserTotalsResponse.from(projector.rebuild(userId));
    }

    /**
     * 200 with the totals when consistent; an inconsistency maps to 500.
     */
    @PostMapping("/admin/users/{userId}/totals/audit")
    public UserTotalsResponse audit(@PathVariable("userId") UUID userId) {
        return UserTotalsResponse.from(auditService.audit(userId));
    }

    @PostMapping("/admin/totals/reconcile")
    public ReconciliationResponse reconcile() {
        return ReconciliationResponse.from(auditService.reconcileAll());
    }
}
