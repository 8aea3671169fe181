package io.github.hotbrkm.tenantmail.agent.email.send.delivery;

import io.github.hotbrkm.tenantmail.agent.email.config.EmailConfig;
import io.github.hotbrkm.tenantmail.agent.email.error.ErrorKind;
import io.github.hotbrkm.tenantmail.agent.email.error.TenantMailException;
import io.github.hotbrkm.tenantmail.agent.email.mime.SignedMessage;
import io.github.hotbrkm.tenantmail.agent.email.send.result.DeliveryResult;
import io.github.hotbrkm.tenantmail.agent.email.send.transport.dns.DnsClient;
import io.github.hotbrkm.tenantmail.agent.email.send.transport.dns.DnsQueryResult;
import io.github.hotbrkm.tenantmail.agent.email.send.transport.dns.MailExchanger;
import io.github.hotbrkm.tenantmail.agent.email.send.transport.routing.RoutingService;
import io.github.hotbrkm.tenantmail.agent.email.send.transport.smtp.SmtpClientFactory;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.Duration;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("DeliveryEngine Test")
class DeliveryEngineTest {

    private static final String FAILURE_COUNTER = "tenantmail.delivery.exchanger.failure";

    @TempDir
    Path tempDir;

    private EmbeddedSimulatorServer server;
    private StubDnsClient dns;
    private SimpleMeterRegistry meterRegistry;
    private SmtpConnectionPool pool;
    private DeliveryEngine engine;

    @BeforeEach
    void setUp() throws Exception {
        server = EmbeddedSimulatorServer.start(tempDir.resolve("inbox"), Map.of(), List.of("@invalid.test"));
        dns = new StubDnsClient();
        meterRegistry = new SimpleMeterRegistry();
        pool = new SmtpConnectionPool(new SmtpClientFactory(SmtpConnectionPoolTest.smtpConfig()), 2, 10, Duration.ofSeconds(1));
        engine = new DeliveryEngine(new RoutingService(new EmailConfig(), dns), pool, meterRegistry);
    }

    @AfterEach
    void tearDown() {
        pool.close();
        server.close();
    }

    @Test
    @DisplayName("Falls over to the next exchanger when the preferred one is down")
    void deliver_failover() throws Exception {
        // Given
        dns.put("dest.test", new MailExchanger(EmbeddedSimulatorServer.unusedServerAddress(), 10),
                new MailExchanger("localhost:" + server.port(), 20));

        // When
        DeliveryResult result = engine.deliver(message("user@dest.test"));

        // Then
        assertThat(result.mxUsed()).isEqualTo("localhost");
        assertThat(result.messageId()).isEqualTo("<1.1@acme.test>");
        assertThat(result.exchangersByDomain()).containsExactly(Map.entry("dest.test", "localhost"));
        assertThat(meterRegistry.get(FAILURE_COUNTER).tag("mx", "127.0.0.1").counter().count()).isEqualTo(1.0d);
        assertThat(server.messages()).hasSize(1);
    }

    @Test
    @DisplayName("Recipients of several domains are delivered per domain")
    void deliver_multipleDomains() throws Exception {
        // Given
        dns.put("dest.test", new MailExchanger(server.serverAddress(), 10));
        dns.put("other.test", new MailExchanger("localhost:" + server.port(), 10));

        // When
        DeliveryResult result = engine.deliver(message("a@dest.test", "b@other.test", "c@dest.test"));

        // Then
        assertThat(result.mxUsed()).isEqualTo("127.0.0.1");
        assertThat(result.exchangersByDomain())
                .containsEntry("dest.test", "127.0.0.1")
                .containsEntry("other.test", "localhost");
        assertThat(server.messages()).hasSize(3);
    }

    @Test
    @DisplayName("A domain without exchangers fails with a retryable NoMXRecords")
    void deliver_noMxRecords() {
        // When & Then
        assertThatThrownBy(() -> engine.deliver(message("user@nomx.test")))
                .isInstanceOf(TenantMailException.class)
                .satisfies(e -> {
                    TenantMailException mailException = (TenantMailException) e;
                    assertThat(mailException.getKind()).isEqualTo(ErrorKind.NO_MX_RECORDS);
                    assertThat(mailException.isRetryable()).isTrue();
                });
    }

    @Test
    @DisplayName("Every exchanger failing raises AllExchangersFailed and counts each failure")
    void deliver_allExchangersFailed() throws Exception {
        // Given
        dns.put("dest.test", new MailExchanger(EmbeddedSimulatorServer.unusedServerAddress(), 10),
                new MailExchanger(EmbeddedSimulatorServer.unusedServerAddress(), 20));

        // When & Then
        assertThatThrownBy(() -> engine.deliver(message("user@dest.test")))
                .isInstanceOf(TenantMailException.class)
                .hasMessageContaining("All 2 exchangers failed")
                .satisfies(e -> assertThat(((TenantMailException) e).getKind()).isEqualTo(ErrorKind.ALL_EXCHANGERS_FAILED));
        assertThat(meterRegistry.get(FAILURE_COUNTER).tag("mx", "127.0.0.1").counter().count()).isEqualTo(2.0d);
    }

    @Test
    @DisplayName("A recipient refused by the exchanger fails the domain")
    void deliver_rejectedRecipient() {
        // Given
        dns.put("invalid.test", new MailExchanger(server.serverAddress(), 10));

        // When & Then
        assertThatThrownBy(() -> engine.deliver(message("nobody@invalid.test")))
                .isInstanceOf(TenantMailException.class)
                .hasMessageContaining("550")
                .satisfies(e -> assertThat(((TenantMailException) e).getKind()).isEqualTo(ErrorKind.ALL_EXCHANGERS_FAILED));
    }

    @Test
    @DisplayName("Malformed recipients are rejected before any connection")
    void deliver_invalidRecipient() {
        // When & Then
        assertThatThrownBy(() -> engine.deliver(message("user@dest.test", "not-an-address")))
                .isInstanceOf(TenantMailException.class)
                .hasMessageContaining("not-an-address")
                .satisfies(e -> assertThat(((TenantMailException) e).getKind()).isEqualTo(ErrorKind.JOB_REJECTED));
        assertThat(dns.queries).isZero();
        assertThatThrownBy(() -> engine.deliver(message()))
                .isInstanceOf(TenantMailException.class)
                .satisfies(e -> assertThat(((TenantMailException) e).getKind()).isEqualTo(ErrorKind.JOB_REJECTED));
    }

    private static SignedMessage message(String... recipients) {
        String content = "From: sender@acme.test\r\nTo: " + String.join(", ", recipients)
                + "\r\nSubject: Delivery\r\nMessage-ID: <1.1@acme.test>\r\n\r\nHello\r\n";
        return new SignedMessage("<1.1@acme.test>", "sender@acme.test", List.of(recipients), content, "acme.test", "mail");
    }

    static class StubDnsClient extends DnsClient {
        private final Map<String, List<MailExchanger>> exchangers = new HashMap<>();
        private int queries;

        StubDnsClient() {
            super(List.of("127.0.0.1"));
        }

        void put(String domain, MailExchanger... mx) {
            exchangers.put(domain, List.of(mx));
        }

        @Override
        public DnsQueryResult queryMxRecords(String domain) {
            queries++;
            List<MailExchanger> found = exchangers.get(domain);
            return found == null ? DnsQueryResult.emptyRecord("600 DNS.query failure No Records Found. Domain: " + domain)
                    : DnsQueryResult.success(found);
        }
    }
}
