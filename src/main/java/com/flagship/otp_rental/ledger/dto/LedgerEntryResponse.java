package com.flagship.otp_rental.ledger.dto;

import com.flagship.otp_rental.ledger.LedgerEntry;
import com.flagship.otp_rental.ledger.LedgerReason;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

@Value
@Builder
public class LedgerEntryResponse {
    UUID id;
    BigDecimal amount;
    LedgerReason reason;
    UUID relatedSessionId;
    String description;
    BigDecimal balanceAfter;
    Instant createdAt;

    public static LedgerEntryResponse from(LedgerEntry entry) {
        return LedgerEntryResponse.builder()
                .id(entry.getId())
                .amount(entry.getAmount())
                .reason(entry.getReason())
                .relatedSessionId(entry.getRelatedSessionId())
                .description(entry.getDescription())
                .balanceAfter(entry.getBalanceAfter())
                .createdAt(entry.getCreatedAt())
                .build();
    }
}
