package com.flagship.otp_rental.refund;

public enum SweepTrigger {
    SCHEDULED,
    MANUAL
}
