package org.abstractica.voicecontrol.impl.directory;

import org.abstractica.voicecontrol.Session;
import org.abstractica.voicecontrol.UdpEndpoint;

import java.time.Instant;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Session record held by {@link DefaultSessionDirectory}.
 *
 * <p>Identity fields are immutable. The UDP binding is replaced as a whole,
 * and only by the directory while it holds its write lock.</p>
 */
public final class DefaultSession implements Session
{
    private final int numericId;
    private final String connectionId;
    private final byte[] secret;
    private final Instant connectedAt;
    private final String clientVersion;
    private final Set<String> permissions;
    private final Set<Integer> subscribedChannels;

    private volatile UdpBinding udpBinding;

    DefaultSession(
            int numericId,
            String connectionId,
            byte[] secret,
            Instant connectedAt,
            String clientVersion
    )
    {
        this.numericId = numericId;
        this.connectionId = Objects.requireNonNull(connectionId, "connectionId");
        this.secret = Objects.requireNonNull(secret, "secret").clone();
        this.connectedAt = Objects.requireNonNull(connectedAt, "connectedAt");
        this.clientVersion = clientVersion;
        this.permissions = ConcurrentHashMap.newKeySet();
        this.subscribedChannels = ConcurrentHashMap.newKeySet();
    }

    @Override
    public int getNumericId()
    {
        return numericId;
    }

    @Override
    public String getConnectionId()
    {
        return connectionId;
    }

    @Override
    public byte[] getSecret()
    {
        return secret.clone();
    }

    @Override
    public Optional<UdpEndpoint> getUdpEndpoint()
    {
        UdpBinding binding = udpBinding;
        return binding == null ? Optional.empty() : Optional.of(binding.endpoint());
    }

    @Override
    public Optional<Instant> getLastUdpActivity()
    {
        UdpBinding binding = udpBinding;
        return binding == null ? Optional.empty() : Optional.of(binding.lastActivity());
    }

    @Override
    public Set<String> getPermissions()
    {
        return permissions;
    }

    @Override
    public Set<Integer> getSubscribedChannels()
    {
        return subscribedChannels;
    }

    @Override
    public Instant getConnectedAt()
    {
        return connectedAt;
    }

    @Override
    public Optional<String> getClientVersion()
    {
        return Optional.ofNullable(clientVersion);
    }

    // ========== Directory Access ==========

    UdpEndpoint currentEndpoint()
    {
        UdpBinding binding = udpBinding;
        return binding == null ? null : binding.endpoint();
    }

    void bindUdp(UdpEndpoint endpoint, Instant now)
    {
        this.udpBinding = new UdpBinding(endpoint, now);
    }

    void unbindUdp()
    {
        this.udpBinding = null;
    }

    @Override
    public String toString()
    {
        return "Session[id=" + numericId + ", connection=" + connectionId
                + ", udp=" + currentEndpoint() + "]";
    }

    /**
     * Endpoint and its confirmation time, swapped together.
     */
    private record UdpBinding(UdpEndpoint endpoint, Instant lastActivity)
    {
    }
}
