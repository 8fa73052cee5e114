package com.flagship.otp_rental.refund;

import com.flagship.otp_rental.refund.dto.ManualCheckResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Operator endpoints for the auto-refund sweep.
 */
@RestController
@RequestMapping("/admin/auto-refund")
@RequiredArgsConstructor
@Slf4j
public class AutoRefundController {

    private final AutoRefundService autoRefundService;
    private final RefundAuditService refundAuditService;

    @GetMapping("/status")
    public ResponseEntity<AutoRefundStatus> getStatus() {
        return ResponseEntity.ok(autoRefundService.getStatus());
    }

    /**
     * Runs a sweep now. 409 if one is already running.
     */
    @PostMapping("/manual-check")
    public ResponseEntity<ManualCheckResponse> manualCheck() {
        log.info("Manual auto-refund check triggered via API");
        return ResponseEntity.ok(ManualCheckResponse.from(autoRefundService.runManualSweep()));
    }

    @GetMapping("/audit")
    public ResponseEntity<RefundAuditReport> audit() {
        return ResponseEntity.ok(refundAuditService.audit());
    }
}
