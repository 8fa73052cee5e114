package com.flagship.otp_rental.ledger;

import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * One immutable movement of a user's balance.
 * Debits carry a negative amount, credits a positive one.
 */
@Value
public class LedgerEntry {
    UUID id;
    Long userId;
    BigDecimal amount;
    LedgerReason reason;
    UUID relatedSessionId;
    String description;
    BigDecimal balanceAfter;
    Instant createdAt;
    Long sequenceNumber;

    public boolean isDebit() {
        return amount.signum() < 0;
    }
}
