package io.github.hotbrkm.tenantmail.agent.email.send.delivery;

import io.github.hotbrkm.tenantmail.agent.email.send.transport.network.HostAndPort;
import io.github.hotbrkm.tenantmail.agent.email.send.transport.smtp.SmtpClient;
import io.github.hotbrkm.tenantmail.agent.email.send.transport.smtp.SmtpClientFactory;
import io.github.hotbrkm.tenantmail.agent.email.send.transport.smtp.SmtpSessionOpenException;
import io.github.hotbrkm.tenantmail.agent.email.send.transport.smtp.SmtpStatus;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentLinkedDeque;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;

/**
 * Persistent SMTP sessions keyed by exchanger host and port, shared by all tenants.
 * <p>
 * At most {@code maxConnections} sessions per host are open or borrowed at once, and a session is closed
 * after {@code maxMessagesPerConnection} messages. Broken sessions are discarded on return.
 */
@Slf4j
public class SmtpConnectionPool implements AutoCloseable {

    private final SmtpClientFactory clientFactory;
    private final int maxConnections;
    private final int maxMessagesPerConnection;
    private final Duration acquireTimeout;
    private final ConcurrentHashMap<String, HostPool> pools = new ConcurrentHashMap<>();
    private volatile boolean closed;

    public SmtpConnectionPool(SmtpClientFactory clientFactory, int maxConnections, int maxMessagesPerConnection,
                              Duration acquireTimeout) {
        this.clientFactory = Objects.requireNonNull(clientFactory, "clientFactory must not be null");
        if (maxConnections <= 0 || maxMessagesPerConnection <= 0) {
            throw new IllegalArgumentException("maxConnections and maxMessagesPerConnection must be positive");
        }
        this.maxConnections = maxConnections;
        this.maxMessagesPerConnection = maxMessagesPerConnection;
        this.acquireTimeout = Objects.requireNonNull(acquireTimeout, "acquireTimeout must not be null");
    }

    /**
     * Borrows an open session to the target, reusing an idle one when it still answers NOOP.
     *
     * @throws SmtpSessionOpenException when no session can be opened or the per-host limit stays exhausted
     *                                  for the whole acquire timeout
     */
    public PooledSmtpConnection acquire(HostAndPort target) {
        if (closed) {
            throw new IllegalStateException("SMTP connection pool is closed");
        }
        HostPool hostPool = pools.computeIfAbsent(target.key(), key -> new HostPool(maxConnections));
        acquirePermit(hostPool, target);

        try {
            PooledSmtpConnection idle;
            while ((idle = hostPool.idle.pollFirst()) != null) {
                if (idle.probe()) {
                    idle.markBorrowed();
                    return idle;
                }
                log.debug("Discarding stale pooled SMTP connection. target={}", target);
                idle.quitAndClose();
            }

            SmtpClient client = clientFactory.create();
            client.open(target, clientFactory.helo());
            log.debug("SMTP connection opened. target={}", target);
            return new PooledSmtpConnection(this, client, target);
        } catch (RuntimeException e) {
            hostPool.permits.release();
            throw e;
        }
    }

    void release(PooledSmtpConnection connection) {
        HostPool hostPool = pools.get(connection.getTarget().key());
        try {
            if (!closed && hostPool != null && connection.isReusable(maxMessagesPerConnection)) {
                hostPool.idle.offerFirst(connection);
            } else {
                connection.quitAndClose();
            }
        } finally {
            if (hostPool != null) {
                hostPool.permits.release();
            }
        }
    }

    public int idleCount(HostAndPort target) {
        HostPool hostPool = pools.get(target.key());
        return hostPool == null ? 0 : hostPool.idle.size();
    }

    /**
     * Sends QUIT on every idle session and refuses further borrowing. Borrowed sessions are closed when returned.
     */
    @Override
    public void close() {
        closed = true;
        List<PooledSmtpConnection> idle = new ArrayList<>();
        pools.values().forEach(hostPool -> {
            PooledSmtpConnection connection;
            while ((connection = hostPool.idle.pollFirst()) != null) {
                idle.add(connection);
            }
        });
        for (PooledSmtpConnection connection : idle) {
            try {
                connection.quitAndClose();
            } catch (RuntimeException e) {
                log.debug("Failed to close pooled SMTP connection. target={}", connection.getTarget(), e);
            }
        }
        log.info("SMTP connection pool closed. closedIdleConnections={}", idle.size());
    }

    private void acquirePermit(HostPool hostPool, HostAndPort target) {
        try {
            if (!hostPool.permits.tryAcquire(acquireTimeout.toMillis(), TimeUnit.MILLISECONDS)) {
                throw new SmtpSessionOpenException(SmtpStatus.TEMPORARY_FAILURE,
                        SmtpStatus.TEMPORARY_FAILURE + " connection pool exhausted after " + acquireTimeout.toMillis() + "ms",
                        target.toString());
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new SmtpSessionOpenException(SmtpStatus.TEMPORARY_FAILURE,
                    SmtpStatus.TEMPORARY_FAILURE + " interrupted while waiting for a connection", target.toString());
        }
    }

    private static final class HostPool {
        private final Semaphore permits;
        private final ConcurrentLinkedDeque<PooledSmtpConnection> idle = new ConcurrentLinkedDeque<>();

        private HostPool(int maxConnections) {
            this.permits = new Semaphore(maxConnections, true);
        }
    }
}
