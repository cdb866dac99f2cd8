package org.greenroute.routing.core;

import lombok.Getter;

import java.util.Objects;

/**
 * Optimization failure surfaced to callers, with a deterministic reason code.
 *
 * <p>Covers request validation (raised in {@link OptimizationStage#INIT}) and fatal
 * internal errors after solving. No partial result accompanies this exception.</p>
 */
@Getter
public final class RouteOptimizationException extends RuntimeException {
    private final String reasonCode;
    private final OptimizationStage stage;

    /**
     * Creates a reason-coded failure.
     *
     * @param reasonCode deterministic reason code.
     * @param stage lifecycle stage reached when the failure occurred.
     * @param message descriptive error message.
     */
    public RouteOptimizationException(String reasonCode, OptimizationStage stage, String message) {
        super(formatMessage(reasonCode, message));
        this.reasonCode = requireReasonCode(reasonCode);
        this.stage = Objects.requireNonNull(stage, "stage");
    }

    /**
     * Creates a reason-coded failure with a cause.
     *
     * @param reasonCode deterministic reason code.
     * @param stage lifecycle stage reached when the failure occurred.
     * @param message descriptive error message.
     * @param cause underlying cause.
     */
    public RouteOptimizationException(String reasonCode, OptimizationStage stage, String message, Throwable cause) {
        super(formatMessage(reasonCode, message), cause);
        this.reasonCode = requireReasonCode(reasonCode);
        this.stage = Objects.requireNonNull(stage, "stage");
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
