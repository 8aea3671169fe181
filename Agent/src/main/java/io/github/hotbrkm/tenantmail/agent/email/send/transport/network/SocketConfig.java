package io.github.hotbrkm.tenantmail.agent.email.send.transport.network;

/**
 * Socket timeouts in milliseconds. {@code bindAddress} is optional; null lets the OS pick the local address.
 */
public record SocketConfig(String bindAddress, int connectionTimeout, int readTimeout) {

    public SocketConfig(int connectionTimeout, int readTimeout) {
        this(null, connectionTimeout, readTimeout);
    }
}
