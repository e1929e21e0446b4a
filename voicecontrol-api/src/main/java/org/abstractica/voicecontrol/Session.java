package org.abstractica.voicecontrol;

import java.time.Instant;
import java.util.Optional;
import java.util.Set;

/**
 * A connected participant as tracked by the {@link SessionDirectory}.
 *
 * <p>Each session has:</p>
 * <ul>
 *   <li>A compact numeric ID (1-65535) used to tag datagrams</li>
 *   <li>The identifier of the control connection that owns it</li>
 *   <li>A 256-bit secret for datagram authentication</li>
 *   <li>An optional UDP endpoint, learned from the first datagram</li>
 * </ul>
 *
 * <p>Identity and addressing fields are owned by the directory and change only
 * through it. The permission and channel sets are mutable and thread-safe;
 * they belong to the gateway.</p>
 */
public interface Session
{
    /**
     * Returns the numeric ID carried in datagrams from this participant.
     *
     * @return numeric ID in [1, 65535]
     */
    int getNumericId();

    /**
     * Returns the identifier of the owning control connection.
     *
     * @return connection ID
     */
    String getConnectionId();

    /**
     * Returns a copy of the 32-byte datagram secret.
     *
     * @return secret bytes
     */
    byte[] getSecret();

    /**
     * Returns the learned UDP endpoint.
     *
     * @return the endpoint, or empty until the first datagram is observed
     */
    Optional<UdpEndpoint> getUdpEndpoint();

    /**
     * Returns when the UDP endpoint was last confirmed.
     *
     * @return last UDP activity, or empty if no endpoint is known
     */
    Optional<Instant> getLastUdpActivity();

    /**
     * Returns the live set of permission identifiers.
     *
     * @return mutable, thread-safe set
     */
    Set<String> getPermissions();

    /**
     * Returns the live set of subscribed channel IDs.
     *
     * @return mutable, thread-safe set
     */
    Set<Integer> getSubscribedChannels();

    /**
     * Returns when the session was created.
     */
    Instant getConnectedAt();

    /**
     * Returns the version string announced by the client.
     *
     * @return client version, or empty if none was supplied
     */
    Optional<String> getClientVersion();
}
