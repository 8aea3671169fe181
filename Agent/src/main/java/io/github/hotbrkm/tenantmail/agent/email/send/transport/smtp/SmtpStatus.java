package io.github.hotbrkm.tenantmail.agent.email.send.transport.smtp;

import java.net.ConnectException;
import java.net.NoRouteToHostException;
import java.net.SocketTimeoutException;

/**
 * SMTP reply codes and the local codes used for transport failures that never reached the server.
 */
public final class SmtpStatus {

    private SmtpStatus() {
    }

    public static final int OK = 250;
    public static final int TEMPORARY_FAILURE = 421;
    /** Could not route to the exchanger. */
    public static final int NO_ROUTE = 601;
    /** Connect failed for any other reason. */
    public static final int CONNECT_FAILED = 602;
    public static final int UNKNOWN_ERROR = 700;
    /** I/O failure in the middle of a conversation. */
    public static final int IO_ERROR = 703;
    /** Read timeout in the middle of a conversation. */
    public static final int READ_TIMEOUT = 704;
    /** Malformed reply or unusable session. */
    public static final int SESSION_INVALID = 888;

    public static int fromException(Throwable e) {
        if (e == null) {
            return UNKNOWN_ERROR;
        }
        if (e instanceof SocketTimeoutException || e instanceof ConnectException || e instanceof NoRouteToHostException) {
            return TEMPORARY_FAILURE;
        }
        if (e instanceof IllegalStateException) {
            return SESSION_INVALID;
        }
        return UNKNOWN_ERROR;
    }

    public static boolean isPermanentFailure(int statusCode) {
        return statusCode >= 500 && statusCode < 600;
    }

    /**
     * Local transport codes mean the connection itself is unusable.
     */
    public static boolean isConnectionBroken(int statusCode) {
        return statusCode == TEMPORARY_FAILURE || statusCode >= 600;
    }

    public static int parseStatusCode(String message) {
        if (message == null || message.length() < 3) {
            return SESSION_INVALID;
        }
        try {
            return Integer.parseInt(message.substring(0, 3));
        } catch (NumberFormatException e) {
            return SESSION_INVALID;
        }
    }
}
