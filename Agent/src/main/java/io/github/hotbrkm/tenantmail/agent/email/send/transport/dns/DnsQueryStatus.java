package io.github.hotbrkm.tenantmail.agent.email.send.transport.dns;

import org.xbill.DNS.Lookup;

public enum DnsQueryStatus {
    SUCCESS, UNRECOVERABLE, TRY_AGAIN, HOST_NOT_FOUND, TYPE_NOT_FOUND, EMPTY_RECORD, UNKNOWN;

    /**
     * Maps a dnsjava {@link Lookup} result code; {@code -1} stands for "no usable records".
     */
    public static DnsQueryStatus of(int statusCode) {
        return switch (statusCode) {
            case -1 -> EMPTY_RECORD;
            case Lookup.SUCCESSFUL -> SUCCESS;
            case Lookup.UNRECOVERABLE -> UNRECOVERABLE;
            case Lookup.TRY_AGAIN -> TRY_AGAIN;
            case Lookup.HOST_NOT_FOUND -> HOST_NOT_FOUND;
            case Lookup.TYPE_NOT_FOUND -> TYPE_NOT_FOUND;
            default -> UNKNOWN;
        };
    }
}
