package io.github.hotbrkm.tenantmail.simulator.smtp.properties;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Configuration properties of the local mail sink, bound from {@code simulator.smtp}.
 *
 * <pre>
 * simulator:
 *   smtp:
 *     port: 1025
 *     inbox-directory: ./inbox
 *     dkim-public-keys:
 *       mail._domainkey.example.com: MIIBIjANBgkq...
 * </pre>
 */
@Getter
@Setter
@ConfigurationProperties(prefix = "simulator.smtp")
public class SimulatorSmtpProperties {

    /**
     * Whether the SMTP server is enabled.
     */
    private boolean enabled = true;

    /**
     * Port number for the SMTP server to listen on. Matches the agent's default relay target.
     */
    private int port = 1025;

    private String hostName;

    private String bindAddress;

    private Integer maxConnections;

    /**
     * Maximum message size in bytes.
     */
    private Integer maxMessageSize;

    /**
     * Directory path for storing received messages.
     */
    private String inboxDirectory;

    /**
     * Whether to store received messages to disk.
     */
    private boolean storeMessages = true;

    /**
     * Whether received messages get an {@code Authentication-Results} header with the DKIM check result.
     */
    private boolean inspectDkim = true;

    /**
     * Public keys (base64 X.509 SubjectPublicKeyInfo) by {@code selector._domainkey.domain}.
     * Without a key only the body hash is checked.
     */
    private Map<String, String> dkimPublicKeys = new LinkedHashMap<>();

    /**
     * Recipient addresses or {@code @domain} suffixes rejected at RCPT with 550.
     */
    private List<String> rejectedRecipients = new ArrayList<>();
}
