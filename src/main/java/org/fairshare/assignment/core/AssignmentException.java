package org.fairshare.assignment.core;

import lombok.Getter;

import java.util.Objects;

/**
 * Failure to build or evolve a plan, tagged with a stable reason code.
 *
 * <p>Codes raised by this library are the {@code REASON_*} constants on
 * {@link AssignmentCore}:</p>
 * <ul>
 * <li>{@code EMPTY_RIDER_SET}: orders cannot be shared out without riders.</li>
 * <li>{@code NO_ALTERNATE_RIDER}: the only rider in the plan rejected an order it holds.</li>
 * <li>{@code INVALID_RELOCATION_TARGET}: a relocation policy picked the rejecting rider
 *     or a rider outside the plan.</li>
 * <li>{@code RIDERS_REQUIRED}, {@code ORDERS_REQUIRED}, {@code PLAN_REQUIRED},
 *     {@code EVENT_REQUIRED}: a required argument was {@code null}.</li>
 * <li>{@code RELOCATION_CONFIG_REQUIRED}, {@code UNKNOWN_RELOCATION_POLICY}: the facade
 *     could not bind a relocation policy.</li>
 * <li>{@code INVARIANT_VIOLATION}: a produced plan failed verification.</li>
 * </ul>
 *
 * <p>The message reads {@code [CODE] detail}. The plan passed into the failing call
 * is left as it was, and a session keeps publishing its previous plan.</p>
 */
@Getter
public final class AssignmentException extends RuntimeException {
    private final String reasonCode;

    /**
     * Creates a reason-coded assignment failure.
     *
     * @param reasonCode deterministic reason code.
     * @param message descriptive error message.
     */
    public AssignmentException(String reasonCode, String message) {
        super(formatMessage(reasonCode, message));
        this.reasonCode = requireReasonCode(reasonCode);
    }

    /**
     * Creates a reason-coded assignment failure with a cause.
     *
     * @param reasonCode deterministic reason code.
     * @param message descriptive error message.
     * @param cause underlying cause.
     */
    public AssignmentException(String reasonCode, String message, Throwable cause) {
        super(formatMessage(reasonCode, message), cause);
        this.reasonCode = requireReasonCode(reasonCode);
    }

    private static String formatMessage(String reasonCode, String message) {
        return "[" + requireReasonCode(reasonCode) + "] " + Objects.requireNonNull(message, "message");
    }

    private static String requireReasonCode(String reasonCode) {
        String code = Objects.requireNonNull(reasonCode, "reasonCode");
        if (code.isBlank()) {
            throw new IllegalArgumentException("reasonCode must be non-blank");
        }
        return code;
    }
}
