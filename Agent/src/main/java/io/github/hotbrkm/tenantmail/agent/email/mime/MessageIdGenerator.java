package io.github.hotbrkm.tenantmail.agent.email.mime;

import java.net.InetAddress;
import java.util.concurrent.atomic.AtomicLong;
import lombok.experimental.UtilityClass;

@UtilityClass
public class MessageIdGenerator {
    private static final AtomicLong INDEX = new AtomicLong(0);
    private static volatile String hostName;

    /**
     * Returns {@code <epochMillis.seq@domain>}, falling back to the local host name when no domain is given.
     */
    public static String next(String domain) {
        long nextIndex = INDEX.updateAndGet(i -> (i + 1) % 10000000L);
        String right = domain == null || domain.isBlank() ? getHostName() : domain.trim().toLowerCase();
        return "<" + System.currentTimeMillis() + "." + nextIndex + "@" + right + ">";
    }

    private static String getHostName() {
        String cached = hostName;
        if (cached != null) {
            return cached;
        }
        synchronized (MessageIdGenerator.class) {
            if (hostName != null) {
                return hostName;
            }
            try {
                hostName = InetAddress.getLocalHost().getHostName();
            } catch (Exception e) {
                hostName = "localhost";
            }
            return hostName;
        }
    }
}
