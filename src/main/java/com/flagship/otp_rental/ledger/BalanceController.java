package com.flagship.otp_rental.ledger;

import com.flagship.otp_rental.config.ApiHeaders;
import com.flagship.otp_rental.dto.PageResponse;
import com.flagship.otp_rental.ledger.dto.BalanceAdjustmentRequest;
import com.flagship.otp_rental.ledger.dto.BalanceResponse;
import com.flagship.otp_rental.ledger.dto.LedgerEntryResponse;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.math.BigDecimal;
import java.util.List;

/**
 * Balance read endpoints for the calling user, plus the operator adjustment endpoint
 * used by support staff and the top-up flow.
 */
@RestController
@Validated
@RequiredArgsConstructor
@Slf4j
public class BalanceController {

    private final BalanceLedgerService ledgerService;

    @GetMapping("/balance")
    public ResponseEntity<BalanceResponse> getBalance(@RequestHeader(ApiHeaders.USER_ID) Long userId) {
        return ResponseEntity.ok(new BalanceResponse(userId, ledgerService.getBalance(userId)));
    }

    @GetMapping("/balance/entries")
    public ResponseEntity<PageResponse<LedgerEntryResponse>> getEntries(
            @RequestHeader(ApiHeaders.USER_ID) Long userId,
            @RequestParam(defaultValue = "0") @Min(0) int page,
            @RequestParam(defaultValue = "20") @Min(1) @Max(200) int size) {

        List<LedgerEntryResponse> entries = ledgerService.findEntries(userId, page, size).stream()
                .map(LedgerEntryResponse::from)
                .toList();

        return ResponseEntity.ok(PageResponse.of(entries, page, size, ledgerService.countEntries(userId)));
    }

    @PostMapping("/admin/users/{userId}/balance-adjustments")
    public ResponseEntity<BalanceResponse> adjustBalance(
            @PathVariable Long userId,
            @Valid @RequestBody BalanceAdjustmentRequest request) {

        log.info("Balance adjustment requested: userId={}, amount={}, reason={}",
                userId, request.getAmount(), request.getReason());

        BigDecimal balance = ledgerService.adjust(userId, request.getAmount(), request.getReason(), request.getNote());
        return ResponseEntity.ok(new BalanceResponse(userId, balance));
    }
}
