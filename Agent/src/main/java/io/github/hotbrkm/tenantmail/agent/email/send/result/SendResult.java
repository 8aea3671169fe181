package io.github.hotbrkm.tenantmail.agent.email.send.result;

/**
 * Outcome of one SMTP transaction against one exchanger.
 */
public record SendResult(boolean success, int statusCode, String errorMessage) {
    public static SendResult success(int code) {
        return new SendResult(true, code, null);
    }

    public static SendResult failure(int code, String msg) {
        return new SendResult(false, code, msg);
    }
}
