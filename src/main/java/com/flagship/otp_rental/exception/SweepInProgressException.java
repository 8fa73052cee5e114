package com.flagship.otp_rental.exception;

public class SweepInProgressException extends RentalException {

    public SweepInProgressException() {
        super("An auto-refund sweep is already in progress");
    }
}
