package io.github.hotbrkm.tenantmail.simulator.smtp.handler;

import io.github.hotbrkm.tenantmail.simulator.smtp.dkim.DkimSignatureInspector;
import io.github.hotbrkm.tenantmail.simulator.smtp.properties.SimulatorSmtpProperties;
import io.github.hotbrkm.tenantmail.simulator.smtp.service.SmtpMessageStore;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.subethamail.smtp.MessageContext;
import org.subethamail.smtp.RejectException;

import java.io.ByteArrayInputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.mock;

@DisplayName("SimulatorMessageHandler Test")
class SimulatorMessageHandlerTest {

    private static final String MESSAGE = "From: sender@example.com\r\nTo: user@dest.test\r\nSubject: hi\r\n\r\nbody\r\n";

    @TempDir
    Path tempDir;

    private SimulatorSmtpProperties properties;
    private SmtpMessageStore messageStore;
    private SimpleMeterRegistry meterRegistry;

    @BeforeEach
    void setUp() {
        properties = new SimulatorSmtpProperties();
        properties.setHostName("smtp.simulator");
        properties.setInboxDirectory(tempDir.toString());
        properties.setRejectedRecipients(List.of("blocked@dest.test", "@invalid.test"));
        messageStore = new SmtpMessageStore(properties);
        messageStore.prepareInboxDirectory();
        meterRegistry = new SimpleMeterRegistry();
    }

    @Test
    @DisplayName("Accepted message is stored with an Authentication-Results header")
    void data_storesMessageWithAuthenticationResults() throws Exception {
        // given
        SimulatorMessageHandler handler = newHandler();
        handler.from("sender@example.com");
        handler.recipient("<user@dest.test>");

        // when
        String response = handler.data(new ByteArrayInputStream(MESSAGE.getBytes(StandardCharsets.US_ASCII)));
        handler.done();

        // then
        assertThat(response).isEqualTo("OK");
        List<Path> stored = messageStore.listMessages();
        assertThat(stored).hasSize(1);
        String content = Files.readString(stored.get(0), StandardCharsets.US_ASCII);
        assertThat(content).startsWith("Authentication-Results: smtp.simulator; dkim=none (no signature)\r\n");
        assertThat(content).endsWith(MESSAGE);
        assertThat(meterRegistry.counter(SimulatorMessageHandler.RECEIVED_COUNTER, "dkim", "none").count()).isEqualTo(1.0);
    }

    @Test
    @DisplayName("Inspection disabled stores the payload unchanged")
    void data_inspectionDisabled_storesPayloadAsIs() throws Exception {
        // given
        properties.setInspectDkim(false);
        SimulatorMessageHandler handler = newHandler();
        handler.from("sender@example.com");
        handler.recipient("user@dest.test");

        // when
        handler.data(new ByteArrayInputStream(MESSAGE.getBytes(StandardCharsets.US_ASCII)));

        // then
        assertThat(Files.readString(messageStore.listMessages().get(0), StandardCharsets.US_ASCII)).isEqualTo(MESSAGE);
        assertThat(meterRegistry.counter(SimulatorMessageHandler.RECEIVED_COUNTER, "dkim", "skipped").count()).isEqualTo(1.0);
    }

    @Test
    @DisplayName("Configured address is rejected with 550")
    void recipient_exactMatch_rejected() {
        // given
        SimulatorMessageHandler handler = newHandler();
        handler.from("sender@example.com");

        // when & then
        assertThatThrownBy(() -> handler.recipient("<Blocked@Dest.test>"))
                .isInstanceOf(RejectException.class)
                .satisfies(e -> assertThat(((RejectException) e).getCode()).isEqualTo(550));
    }

    @Test
    @DisplayName("Configured domain suffix is rejected with 550")
    void recipient_domainMatch_rejected() {
        // given
        SimulatorMessageHandler handler = newHandler();

        // when & then
        assertThatThrownBy(() -> handler.recipient("anyone@invalid.test"))
                .isInstanceOf(RejectException.class)
                .satisfies(e -> assertThat(((RejectException) e).getCode()).isEqualTo(550));
    }

    @Test
    @DisplayName("Message is stored only for accepted recipients")
    void data_storesOnlyAcceptedRecipients() throws Exception {
        // given
        SimulatorMessageHandler handler = newHandler();
        handler.from("sender@example.com");
        handler.recipient("user@dest.test");
        assertThatThrownBy(() -> handler.recipient("blocked@dest.test")).isInstanceOf(RejectException.class);

        // when
        handler.data(new ByteArrayInputStream(MESSAGE.getBytes(StandardCharsets.US_ASCII)));

        // then
        List<Path> stored = messageStore.listMessages();
        assertThat(stored).hasSize(1);
        assertThat(stored.get(0).getFileName().toString()).contains("user@dest.test");
    }

    @Test
    @DisplayName("DATA without accepted recipients is rejected with 554")
    void data_withoutRecipients_rejected() {
        // given
        SimulatorMessageHandler handler = newHandler();
        handler.from("sender@example.com");

        // when & then
        assertThatThrownBy(() -> handler.data(new ByteArrayInputStream(MESSAGE.getBytes(StandardCharsets.US_ASCII))))
                .isInstanceOf(RejectException.class)
                .satisfies(e -> assertThat(((RejectException) e).getCode()).isEqualTo(554));
    }

    private SimulatorMessageHandler newHandler() {
        return new SimulatorMessageHandler(mock(MessageContext.class), properties, messageStore,
                new DkimSignatureInspector(Map.of()), meterRegistry);
    }
}
