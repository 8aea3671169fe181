package io.github.hotbrkm.tenantmail.agent.email.send.transport.dns;

import java.util.List;

/**
 * Outcome of an MX query. {@code exchangers} is sorted by priority and empty unless the query succeeded.
 */
public record DnsQueryResult(DnsQueryStatus status, String message, List<MailExchanger> exchangers) {

    public DnsQueryResult {
        exchangers = exchangers == null ? List.of() : List.copyOf(exchangers);
    }

    public static DnsQueryResult emptyRecord(String message) {
        return new DnsQueryResult(DnsQueryStatus.EMPTY_RECORD, message, List.of());
    }

    public static DnsQueryResult success(List<MailExchanger> exchangers) {
        return new DnsQueryResult(DnsQueryStatus.SUCCESS, "SUCCESS", exchangers.stream().sorted(MailExchanger.BY_PRIORITY).toList());
    }

    public boolean isSuccess() {
        return status == DnsQueryStatus.SUCCESS && !exchangers.isEmpty();
    }

    public boolean isTypeNotFound() {
        return status == DnsQueryStatus.TYPE_NOT_FOUND;
    }
}
