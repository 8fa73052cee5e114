package com.flagship.otp_rental.refund;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * Snapshot of the auto-refund scheduler for operators.
 */
@Value
@Builder
public class AutoRefundStatus {

    /** Scheduler enabled and not shut down. */
    @JsonProperty("isRunning")
    boolean running;

    /** A sweep is executing right now. */
    boolean sweepInProgress;

    Instant lastCheck;

    Instant nextCheck;

    /** Delay between the end of one sweep and the start of the next, in seconds. */
    long interval;

    long totalChecks;

    SweepResult lastResult;
}
