package io.github.hotbrkm.tenantmail.simulator.smtp.service;

import io.github.hotbrkm.tenantmail.simulator.smtp.properties.SimulatorSmtpProperties;
import jakarta.annotation.PostConstruct;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardOpenOption;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.stream.Stream;

/**
 * Inbox of the mail sink: one {@code .eml} file per accepted recipient, named
 * {@code <timestamp>-<recipient>-<random>.eml}.
 */
@Slf4j
@Component
public class SmtpMessageStore {

    private static final DateTimeFormatter FILE_NAME_FORMATTER = DateTimeFormatter.ofPattern("yyyyMMddHHmmssSSS");
    private static final String EXTENSION = ".eml";

    private final boolean enabled;
    @Getter
    private final Path inboxDirectory;

    public SmtpMessageStore(SimulatorSmtpProperties properties) {
        this.enabled = properties.isStoreMessages();
        this.inboxDirectory = resolveInboxDirectory(properties.getInboxDirectory());
    }

    @PostConstruct
    public void prepareInboxDirectory() {
        if (!enabled) {
            log.info("Inbox storage is disabled.");
            return;
        }
        try {
            Files.createDirectories(inboxDirectory);
            log.info("Inbox directory ready. path={}", inboxDirectory.toAbsolutePath());
        } catch (IOException e) {
            throw new IllegalStateException("Failed to create inbox directory: " + inboxDirectory, e);
        }
    }

    /**
     * Writes the payload once per recipient.
     *
     * @return the written files, empty when storage is disabled
     */
    public List<Path> store(String from, List<String> recipients, byte[] payload) throws IOException {
        if (!enabled) {
            return List.of();
        }
        List<Path> written = new ArrayList<>(recipients.size());
        for (String recipient : recipients) {
            Path messagePath = inboxDirectory.resolve(fileNameFor(recipient));
            Files.write(messagePath, payload, StandardOpenOption.CREATE_NEW);
            written.add(messagePath);
            log.info("Mail stored. from={}, to={}, path={}", from, recipient, messagePath.getFileName());
        }
        return written;
    }

    /**
     * Stored messages in file-name order, which is arrival order.
     */
    public List<Path> listMessages() throws IOException {
        if (!Files.isDirectory(inboxDirectory)) {
            return List.of();
        }
        try (Stream<Path> files = Files.list(inboxDirectory)) {
            return files.filter(Files::isRegularFile)
                    .filter(path -> path.getFileName().toString().endsWith(EXTENSION))
                    .sorted()
                    .toList();
        }
    }

    private static Path resolveInboxDirectory(String inboxDir) {
        if (inboxDir == null || inboxDir.isBlank()) {
            throw new IllegalStateException("Property 'simulator.smtp.inbox-directory' is required.");
        }
        return Paths.get(inboxDir);
    }

    private static String fileNameFor(String recipient) {
        String sanitized = recipient == null ? "unknown" : recipient.replaceAll("[^a-zA-Z0-9@._-]", "_");
        return FILE_NAME_FORMATTER.format(LocalDateTime.now()) + "-" + sanitized + "-"
                + UUID.randomUUID().toString().substring(0, 8) + EXTENSION;
    }
}
