package com.flagship.otp_rental.rental;

/**
 * What {@link RentalSettlementService#repairRefund} had to do for a session.
 */
public enum RepairOutcome {
    /** Already refunded, or not in a refundable state. */
    NOTHING_TO_REPAIR,
    /** Refund entry existed; only the flag was missing. */
    FLAG_SET,
    /** Refund credited and flag set. */
    CREDITED;

    public boolean isRepaired() {
        return this != NOTHING_TO_REPAIR;
    }
}
