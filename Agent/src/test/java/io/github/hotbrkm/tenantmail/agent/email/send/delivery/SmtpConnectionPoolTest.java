package io.github.hotbrkm.tenantmail.agent.email.send.delivery;

import io.github.hotbrkm.tenantmail.agent.email.config.EmailConfig;
import io.github.hotbrkm.tenantmail.agent.email.send.result.SendResult;
import io.github.hotbrkm.tenantmail.agent.email.send.transport.network.HostAndPort;
import io.github.hotbrkm.tenantmail.agent.email.send.transport.smtp.SmtpClientFactory;
import io.github.hotbrkm.tenantmail.agent.email.send.transport.smtp.SmtpSessionOpenException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("SmtpConnectionPool Test")
class SmtpConnectionPoolTest {

    private static final String CONTENT = "From: sender@acme.test\r\nTo: user@dest.test\r\nSubject: Pool\r\n\r\nHello\r\n";

    @TempDir
    Path tempDir;

    private EmbeddedSimulatorServer server;
    private HostAndPort target;
    private SmtpClientFactory clientFactory;

    @BeforeEach
    void setUp() throws Exception {
        server = EmbeddedSimulatorServer.start(tempDir.resolve("inbox"), Map.of(), List.of("@invalid.test"));
        target = HostAndPort.parse(server.serverAddress(), 25);
        clientFactory = new SmtpClientFactory(smtpConfig());
    }

    @AfterEach
    void tearDown() {
        server.close();
    }

    @Test
    @DisplayName("Returned connections are reused by the next borrower")
    void acquire_reusesIdleConnection() throws Exception {
        // Given
        try (SmtpConnectionPool pool = new SmtpConnectionPool(clientFactory, 2, 10, Duration.ofSeconds(1))) {
            PooledSmtpConnection first = pool.acquire(target);
            SendResult firstResult = first.send("sender@acme.test", List.of("user@dest.test"), CONTENT);
            first.close();

            // When
            PooledSmtpConnection second = pool.acquire(target);
            SendResult secondResult = second.send("sender@acme.test", List.of("user@dest.test"), CONTENT);

            // Then
            assertThat(firstResult.success()).isTrue();
            assertThat(firstResult.statusCode()).isEqualTo(250);
            assertThat(secondResult.success()).isTrue();
            assertThat(second).isSameAs(first);
            assertThat(second.getMessagesSent()).isEqualTo(2);
            second.close();
            assertThat(pool.idleCount(target)).isEqualTo(1);
        }
        assertThat(server.messages()).hasSize(2);
    }

    @Test
    @DisplayName("A connection is retired after its message limit")
    void release_retiresAfterMessageLimit() {
        // Given
        try (SmtpConnectionPool pool = new SmtpConnectionPool(clientFactory, 2, 1, Duration.ofSeconds(1))) {
            // When
            try (PooledSmtpConnection connection = pool.acquire(target)) {
                connection.send("sender@acme.test", List.of("user@dest.test"), CONTENT);
            }

            // Then
            assertThat(pool.idleCount(target)).isZero();
        }
    }

    @Test
    @DisplayName("A rejected recipient fails the send but keeps the session usable")
    void send_rejectedRecipient() {
        // Given
        try (SmtpConnectionPool pool = new SmtpConnectionPool(clientFactory, 2, 10, Duration.ofSeconds(1))) {
            SendResult result;

            // When
            try (PooledSmtpConnection connection = pool.acquire(target)) {
                result = connection.send("sender@acme.test", List.of("nobody@invalid.test"), CONTENT);
            }

            // Then
            assertThat(result.success()).isFalse();
            assertThat(result.statusCode()).isEqualTo(550);
            assertThat(pool.idleCount(target)).isEqualTo(1);
        }
    }

    @Test
    @DisplayName("Unreachable targets raise an open failure and give the permit back")
    void acquire_unreachableTarget() throws Exception {
        // Given
        HostAndPort unused = HostAndPort.parse(EmbeddedSimulatorServer.unusedServerAddress(), 25);
        try (SmtpConnectionPool pool = new SmtpConnectionPool(clientFactory, 1, 10, Duration.ofMillis(200))) {
            // When & Then
            assertThatThrownBy(() -> pool.acquire(unused))
                    .isInstanceOf(SmtpSessionOpenException.class)
                    .hasMessageContaining(unused.toString());
            assertThatThrownBy(() -> pool.acquire(unused))
                    .isInstanceOf(SmtpSessionOpenException.class)
                    .hasMessageNotContaining("exhausted");
        }
    }

    @Test
    @DisplayName("Borrowers wait at most the acquire timeout when the host limit is reached")
    void acquire_exhausted() {
        // Given
        try (SmtpConnectionPool pool = new SmtpConnectionPool(clientFactory, 1, 10, Duration.ofMillis(100))) {
            try (PooledSmtpConnection held = pool.acquire(target)) {
                // When & Then
                assertThat(held.getTarget()).isEqualTo(target);
                assertThatThrownBy(() -> pool.acquire(target))
                        .isInstanceOf(SmtpSessionOpenException.class)
                        .hasMessageContaining("pool exhausted");
            }
            assertThat(pool.idleCount(target)).isEqualTo(1);
        }
    }

    @Test
    @DisplayName("A closed pool refuses to lend connections")
    void acquire_afterClose() {
        // Given
        SmtpConnectionPool pool = new SmtpConnectionPool(clientFactory, 1, 10, Duration.ofMillis(100));
        pool.acquire(target).close();

        // When
        pool.close();

        // Then
        assertThat(pool.idleCount(target)).isZero();
        assertThatThrownBy(() -> pool.acquire(target))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("closed");
    }

    static EmailConfig.Smtp smtpConfig() {
        EmailConfig.Smtp smtp = new EmailConfig.Smtp();
        smtp.setHelo("agent.acme.test");
        smtp.setConnectTimeoutMs(2_000);
        smtp.setReadTimeoutMs(5_000);
        smtp.setGreetingTimeoutMs(5_000);
        smtp.setDataReadTimeoutMs(5_000);
        return smtp;
    }
}
