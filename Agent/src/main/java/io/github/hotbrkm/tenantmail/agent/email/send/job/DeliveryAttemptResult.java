package io.github.hotbrkm.tenantmail.agent.email.send.job;

import io.github.hotbrkm.tenantmail.agent.email.error.ErrorKind;

/**
 * Result of one processing attempt. Lives only until it is folded into the outcome log and the audit event.
 */
public record DeliveryAttemptResult(boolean success,
                                    String messageId,
                                    String mxUsed,
                                    ErrorKind errorKind,
                                    String errorMessage,
                                    long durationMs) {

    public static DeliveryAttemptResult delivered(String messageId, String mxUsed, long durationMs) {
        return new DeliveryAttemptResult(true, messageId, mxUsed, null, null, durationMs);
    }

    public static DeliveryAttemptResult failed(String messageId, ErrorKind errorKind, String errorMessage, long durationMs) {
        return new DeliveryAttemptResult(false, messageId, null, errorKind, errorMessage, durationMs);
    }

    public String errorCode() {
        return errorKind == null ? null : errorKind.getCode();
    }
}
