package io.github.hotbrkm.tenantmail.agent.email.send.transport.dns;

import lombok.Getter;
import lombok.Setter;
import lombok.extern.slf4j.Slf4j;
import org.xbill.DNS.Lookup;
import org.xbill.DNS.MXRecord;
import org.xbill.DNS.Record;
import org.xbill.DNS.SimpleResolver;
import org.xbill.DNS.TextParseException;
import org.xbill.DNS.Type;

import java.net.UnknownHostException;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * MX resolver over dnsjava. Each configured server is asked in turn; a server answering TRY_AGAIN is retried
 * up to {@code retryCount} times before moving on.
 */
@Getter
@Setter
@Slf4j
public class DnsClient {

    private static final String MX_RECORD = "MX";

    private final List<String> dnsServerArray;
    private int retryCount = 3;
    private boolean traceLog;

    public DnsClient(List<String> dnsServerArray) {
        if (dnsServerArray == null || dnsServerArray.isEmpty()) {
            throw new IllegalArgumentException("dnsServerArray must not be null or empty");
        }

        List<String> sanitizedServers = dnsServerArray.stream()
                .filter(Objects::nonNull)
                .map(String::trim)
                .filter(s -> !s.isBlank())
                .toList();
        if (sanitizedServers.isEmpty()) {
            throw new IllegalArgumentException("dnsServerArray must contain at least one valid DNS server");
        }

        this.dnsServerArray = List.copyOf(sanitizedServers);
    }

    public DnsQueryResult queryMxRecords(String domain) {
        if (domain == null || domain.isBlank()) {
            return DnsQueryResult.emptyRecord("600 DNS.error. domain is empty");
        }

        for (String dnsServer : dnsServerArray) {
            for (int i = 0; i < retryCount; i++) {
                Lookup lookup;
                try {
                    lookup = new Lookup(domain, Type.MX);
                    lookup.setResolver(new SimpleResolver(dnsServer));
                } catch (TextParseException e) {
                    return DnsQueryResult.emptyRecord("600 DNS.error. invalid domain " + domain);
                } catch (UnknownHostException e) {
                    log.warn("Invalid DNS server host for MX query. dnsServer={}, domain={}", dnsServer, domain, e);
                    break;
                }
                lookup.run();
                int result = lookup.getResult();
                if (traceLog) {
                    log.info("MX lookup. dnsServer={}, domain={}, result={}", dnsServer, domain, lookup.getErrorString());
                }

                if (result == Lookup.SUCCESSFUL) {
                    List<MailExchanger> exchangers = extractMailExchangers(lookup.getAnswers());
                    if (exchangers.isEmpty()) {
                        return DnsQueryResult.emptyRecord(getErrorMessage(-1, domain));
                    }
                    return DnsQueryResult.success(exchangers);
                }
                if (result == Lookup.TYPE_NOT_FOUND || result == Lookup.HOST_NOT_FOUND) {
                    return new DnsQueryResult(DnsQueryStatus.of(result), getErrorMessage(result, domain), List.of());
                }
                if (result != Lookup.TRY_AGAIN) {
                    break;
                }
            }
        }

        return DnsQueryResult.emptyRecord(getErrorMessage(-1, domain));
    }

    private String getErrorMessage(int resultCode, String domain) {
        return switch (resultCode) {
            case -1 -> "600 DNS.query failure No Records Found. Domain: " + domain + ", Type: " + MX_RECORD;
            case Lookup.SUCCESSFUL -> "SUCCESS";
            case Lookup.TRY_AGAIN -> "600 DNS.query failure Try Again. Domain: " + domain + ", Type: " + MX_RECORD;
            case Lookup.HOST_NOT_FOUND -> "610 DNS.query failure UnknownHost. Domain: " + domain + ", Type: " + MX_RECORD;
            case Lookup.UNRECOVERABLE -> "600 DNS.query failure UNRECOVERABLE. Domain: " + domain + ", Type: " + MX_RECORD;
            case Lookup.TYPE_NOT_FOUND -> "600 DNS.query failure Type Not Found. Domain: " + domain + ", Type: " + MX_RECORD;
            default -> "600 DNS.query failure Code: " + resultCode + ", Domain: " + domain + ", Type: " + MX_RECORD;
        };
    }

    static List<MailExchanger> extractMailExchangers(Record[] answers) {
        if (answers == null) {
            return List.of();
        }

        // A null MX (RFC 7505) advertises "." and means the domain accepts no mail.
        return Arrays.stream(answers)
                .filter(MXRecord.class::isInstance)
                .map(MXRecord.class::cast)
                .filter(it -> !".".equals(it.getTarget().toString()))
                .map(it -> new MailExchanger(it.getTarget().toString(), it.getPriority()))
                .sorted(MailExchanger.BY_PRIORITY)
                .toList();
    }
}
