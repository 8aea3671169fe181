package io.github.hotbrkm.tenantmail.agent.email.config;

import io.github.hotbrkm.tenantmail.agent.email.send.queue.JobClass;
import io.github.hotbrkm.tenantmail.agent.email.send.queue.QueuePolicy;
import lombok.Data;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.ZoneId;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

@Data
@ConfigurationProperties(prefix = "email")
@ConditionalOnProperty(prefix = "email", name = "enabled", havingValue = "true")
@Component
public class EmailConfig {

    private Smtp smtp = new Smtp();
    private Delivery delivery = new Delivery();
    private Tenant tenant = new Tenant();
    private Queue queue = new Queue();

    @Data
    public static class Smtp {
        public static final String DEFAULT_HELO = "localhost";
        public static final int DEFAULT_PORT = 25;
        public static final int DEFAULT_CONNECT_TIMEOUT_MS = 60_000;
        public static final int DEFAULT_READ_TIMEOUT_MS = 60_000;
        public static final int DEFAULT_GREETING_TIMEOUT_MS = 30_000;
        public static final int DEFAULT_DATA_READ_TIMEOUT_MS = 60_000;

        private String helo;
        private int port = DEFAULT_PORT;
        private int connectTimeoutMs = DEFAULT_CONNECT_TIMEOUT_MS;
        private int readTimeoutMs = DEFAULT_READ_TIMEOUT_MS;
        private int greetingTimeoutMs = DEFAULT_GREETING_TIMEOUT_MS;
        private int dataReadTimeoutMs = DEFAULT_DATA_READ_TIMEOUT_MS;
        private String bindAddress;

        private List<String> tlsEnabledProtocols = List.of("TLSv1.2", "TLSv1.3");
        private int tlsMaxAttempts = 2;
        private long tlsRetryDelayMs = 1000L;
        private boolean tlsRequired;

        private boolean trace;

        public String resolveHelo() {
            return helo == null || helo.isBlank() ? DEFAULT_HELO : helo;
        }

        public int resolvePort() {
            return port > 0 ? port : DEFAULT_PORT;
        }

        public int resolveConnectTimeoutMs() {
            return connectTimeoutMs > 0 ? connectTimeoutMs : DEFAULT_CONNECT_TIMEOUT_MS;
        }

        public int resolveReadTimeoutMs() {
            return readTimeoutMs > 0 ? readTimeoutMs : DEFAULT_READ_TIMEOUT_MS;
        }

        public int resolveGreetingTimeoutMs() {
            return greetingTimeoutMs > 0 ? greetingTimeoutMs : DEFAULT_GREETING_TIMEOUT_MS;
        }

        public int resolveDataReadTimeoutMs() {
            return dataReadTimeoutMs > 0 ? dataReadTimeoutMs : DEFAULT_DATA_READ_TIMEOUT_MS;
        }
    }

    @Data
    public static class Delivery {
        public static final String DEFAULT_RELAY_SERVER = "127.0.0.1:1025";
        public static final int DEFAULT_POOL_MAX_CONNECTIONS = 5;
        public static final int DEFAULT_POOL_MAX_MESSAGES_PER_CONNECTION = 100;
        public static final long DEFAULT_POOL_ACQUIRE_TIMEOUT_MS = 30_000L;

        private List<String> dnsServer = List.of("8.8.8.8");
        private int dnsRetryCount = 3;
        private boolean dnsTrace;

        private boolean relayEnabled;
        private String relayServer = DEFAULT_RELAY_SERVER;

        private int poolMaxConnections = DEFAULT_POOL_MAX_CONNECTIONS;
        private int poolMaxMessagesPerConnection = DEFAULT_POOL_MAX_MESSAGES_PER_CONNECTION;
        private long poolAcquireTimeoutMs = DEFAULT_POOL_ACQUIRE_TIMEOUT_MS;

        public String resolveRelayServer() {
            return relayServer == null || relayServer.isBlank() ? DEFAULT_RELAY_SERVER : relayServer;
        }

        public int resolvePoolMaxConnections() {
            return poolMaxConnections > 0 ? poolMaxConnections : DEFAULT_POOL_MAX_CONNECTIONS;
        }

        public int resolvePoolMaxMessagesPerConnection() {
            return poolMaxMessagesPerConnection > 0 ? poolMaxMessagesPerConnection : DEFAULT_POOL_MAX_MESSAGES_PER_CONNECTION;
        }

        public Duration resolvePoolAcquireTimeout() {
            return Duration.ofMillis(poolAcquireTimeoutMs > 0 ? poolAcquireTimeoutMs : DEFAULT_POOL_ACQUIRE_TIMEOUT_MS);
        }
    }

    @Data
    public static class Tenant {
        public static final Duration DEFAULT_CONTEXT_TTL = Duration.ofMinutes(5);
        public static final long DEFAULT_LOAD_TIMEOUT_MS = 5_000L;
        public static final String DEFAULT_TIMEZONE = "America/Sao_Paulo";

        private Duration contextTtl = DEFAULT_CONTEXT_TTL;
        private long loadTimeoutMs = DEFAULT_LOAD_TIMEOUT_MS;
        private String defaultTimezone = DEFAULT_TIMEZONE;

        public Duration resolveContextTtl() {
            return contextTtl == null || contextTtl.isNegative() || contextTtl.isZero() ? DEFAULT_CONTEXT_TTL : contextTtl;
        }

        public Duration resolveLoadTimeout() {
            return Duration.ofMillis(loadTimeoutMs > 0 ? loadTimeoutMs : DEFAULT_LOAD_TIMEOUT_MS);
        }

        public ZoneId resolveDefaultTimezone() {
            return ZoneId.of(defaultTimezone == null || defaultTimezone.isBlank() ? DEFAULT_TIMEZONE : defaultTimezone);
        }
    }

    @Data
    public static class Queue {
        public static final double DEFAULT_JITTER_RATIO = 0.2d;
        public static final long DEFAULT_SIGNING_TIMEOUT_MS = 10_000L;

        private double jitterRatio = DEFAULT_JITTER_RATIO;
        private long signingTimeoutMs = DEFAULT_SIGNING_TIMEOUT_MS;
        private Map<JobClass, ClassPolicy> classes = new EnumMap<>(JobClass.class);

        public double resolveJitterRatio() {
            return jitterRatio >= 0 && jitterRatio <= 1 ? jitterRatio : DEFAULT_JITTER_RATIO;
        }

        public Duration resolveSigningTimeout() {
            return Duration.ofMillis(signingTimeoutMs > 0 ? signingTimeoutMs : DEFAULT_SIGNING_TIMEOUT_MS);
        }

        /**
         * Default policy of the job class with any configured override applied. Zero or negative values keep the default.
         */
        public QueuePolicy resolvePolicy(JobClass jobClass) {
            QueuePolicy defaults = jobClass.getDefaultPolicy();
            ClassPolicy override = classes == null ? null : classes.get(jobClass);
            if (override == null) {
                return defaults;
            }
            return new QueuePolicy(
                    override.getConcurrency() > 0 ? override.getConcurrency() : defaults.concurrency(),
                    override.getAttempts() > 0 ? override.getAttempts() : defaults.maxAttempts(),
                    override.getBackoffBaseMs() > 0 ? Duration.ofMillis(override.getBackoffBaseMs()) : defaults.backoffBase(),
                    override.getBackoffMaxMs() > 0 ? Duration.ofMillis(override.getBackoffMaxMs()) : defaults.backoffMax(),
                    defaults.keepCompleted(),
                    defaults.keepFailed(),
                    defaults.completedRetention(),
                    defaults.failedRetention());
        }
    }

    @Data
    public static class ClassPolicy {
        private int concurrency;
        private int attempts;
        private long backoffBaseMs;
        private long backoffMaxMs;
    }
}
