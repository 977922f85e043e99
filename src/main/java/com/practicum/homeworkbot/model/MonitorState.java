package com.practicum.homeworkbot.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Builder;
import lombok.Value;

/**
 * Everything the poll loop remembers between cycles. Replaced as a whole so cursor and verdict commit together.
 */
@Value
@Builder(toBuilder = true)
@Schema(description = "Current state of the homework status poller")
public class MonitorState {

    @Schema(description = "Epoch seconds passed as from_date on the next fetch", example = "1700000000")
    long cursor;

    @Schema(description = "Last verdict reported to the channel; null until something was reported", example = "PENDING")
    Verdict observedVerdict;

    @Schema(description = "Last failure that was alerted; cleared by a successful cycle")
    ErrorSignature lastError;

    @Schema(description = "Outcome of the most recent cycle", example = "NO_CHANGE")
    CycleOutcome lastOutcome;

    @Schema(description = "Epoch milliseconds of the last successful cycle, 0 if none", example = "1700000000000")
    long lastSuccessAt;

    @Schema(description = "Number of cycles run since startup", example = "12")
    long cycles;
}
