package com.flagship.otp_rental.ledger.dto;

import com.flagship.otp_rental.ledger.LedgerReason;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

/**
 * Operator request to move a user's balance. Negative amounts debit.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class BalanceAdjustmentRequest {

    @NotNull(message = "Amount is required")
    private BigDecimal amount;

    @NotNull(message = "Reason is required")
    private LedgerReason reason;

    @Size(max = 255, message = "Note must be at most 255 characters")
    private String note;
}
