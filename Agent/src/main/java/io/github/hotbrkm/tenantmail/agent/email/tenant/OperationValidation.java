package io.github.hotbrkm.tenantmail.agent.email.tenant;

import io.github.hotbrkm.tenantmail.agent.email.error.TenantMailException;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Outcome of {@link TenantContextProvider#validateOperation}. A denial is a value, not an exception;
 * {@code metadata} carries the counters the decision was based on.
 */
public record OperationValidation(boolean allowed, DenialReason reason, String message, Map<String, Object> metadata) {

    public OperationValidation {
        metadata = metadata == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
    }

    public static OperationValidation allow(Map<String, Object> metadata) {
        return new OperationValidation(true, null, null, metadata);
    }

    public static OperationValidation deny(DenialReason reason, String message) {
        return new OperationValidation(false, reason, message, Map.of());
    }

    public static OperationValidation deny(DenialReason reason, String message, Map<String, Object> metadata) {
        return new OperationValidation(false, reason, message, metadata);
    }

    /**
     * Converts a denial into the exception a job terminates with.
     *
     * @throws IllegalStateException if the operation was allowed
     */
    public TenantMailException toException() {
        if (allowed) {
            throw new IllegalStateException("Operation was allowed");
        }
        return new TenantMailException(reason.getErrorKind(), message);
    }
}
