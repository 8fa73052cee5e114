package com.flagship.otp_rental.refund.dto;

import com.flagship.otp_rental.refund.SweepResult;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;

@Value
@Builder
public class ManualCheckResponse {
    String message;
    int refundedCount;
    Map<String, Integer> refundedByServiceType;
    BigDecimal refundedAmount;
    int skippedCount;
    int repairedCount;
    int errorCount;
    List<SweepResult.SweepError> errors;
    long durationMs;

    public static ManualCheckResponse from(SweepResult result) {
        return ManualCheckResponse.builder()
                .message(String.format("Auto-refund check completed: %d sessions refunded", result.getRefundedCount()))
                .refundedCount(result.getRefundedCount())
                .refundedByServiceType(result.getRefundedByServiceType())
                .refundedAmount(result.getRefundedAmount())
                .skippedCount(result.getSkippedCount())
                .repairedCount(result.getRepairedCount())
                .errorCount(result.getErrorCount())
                .errors(result.getErrors())
                .durationMs(result.getDurationMs())
                .build();
    }
}
