package org.itinera.planning;

import lombok.Getter;

import java.util.Objects;

/**
 * Trip-planning contract exception with deterministic reason codes.
 *
 * <p>Messages are prefixed with the reason code so callers and logs see the same
 * stable identifier regardless of message wording.</p>
 */
@Getter
public class TripPlanningException extends RuntimeException {
    private final String reasonCode;

    /**
     * Creates a reason-coded planning failure.
     *
     * @param reasonCode deterministic reason code.
     * @param message descriptive error message.
     */
    public TripPlanningException(String reasonCode, String message) {
        super(formatMessage(reasonCode, message));
        this.reasonCode = requireReasonCode(reasonCode);
    }

    /**
     * Creates a reason-coded planning failure with a cause.
     *
     * @param reasonCode deterministic reason code.
     * @param message descriptive error message.
     * @param cause underlying cause.
     */
    public TripPlanningException(String reasonCode, String message, Throwable cause) {
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
