package com.flagship.otp_rental.ledger;

import java.util.EnumSet;
import java.util.Set;

/**
 * Why a balance moved. Stored as the enum name in {@code balance_ledger_entries.reason}.
 */
public enum LedgerReason {
    /** Price of a rental, taken when the session opens. */
    RENTAL_DEBIT,
    /** Return of a rental's price after expiry or cancellation. */
    RENTAL_REFUND,
    /** Money added by the top-up flow. */
    TOPUP,
    /** Manual correction by an operator, either sign. */
    ADMIN_ADJUST;

    /** Reasons an operator may use through the admin API. */
    public static final Set<LedgerReason> MANUAL = EnumSet.of(TOPUP, ADMIN_ADJUST);

    public boolean isManual() {
        return MANUAL.contains(this);
    }
}
