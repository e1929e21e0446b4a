package org.abstractica.voicecontrol;

import java.util.Collection;
import java.util.Optional;

/**
 * Registry of every live session, indexed by numeric ID, by control
 * connection, and by UDP endpoint.
 *
 * <p>One instance is shared by all connection handlers and by the datagram
 * path. Implementations must be thread-safe: mutations are atomic across all
 * three indices and lookups never observe a half-applied mutation.</p>
 *
 * <p>Validation failures are reported as {@code false} results, never as
 * exceptions. The only exceptional outcome is running out of numeric IDs.</p>
 */
public interface SessionDirectory
{
    /**
     * Lowest numeric ID handed out. Zero is reserved as "invalid".
     */
    int MIN_NUMERIC_ID = 1;

    /**
     * Highest numeric ID handed out.
     */
    int MAX_NUMERIC_ID = 65535;

    // ========== Mutation ==========

    /**
     * Creates a session without a client version.
     *
     * @param connectionId the owning control connection
     * @return the new session
     * @throws DirectoryFullException if every numeric ID is in use
     * @throws IllegalStateException  if the connection already owns a session
     */
    default Session createSession(String connectionId)
    {
        return createSession(connectionId, null);
    }

    /**
     * Creates a session, allocating the next free numeric ID and a fresh secret.
     *
     * @param connectionId  the owning control connection
     * @param clientVersion the client's version string, or null if unknown
     * @return the new session
     * @throws DirectoryFullException if every numeric ID is in use
     * @throws IllegalStateException  if the connection already owns a session
     */
    Session createSession(String connectionId, String clientVersion);

    /**
     * Records the UDP endpoint a session's datagrams arrive from.
     *
     * <p>A previous endpoint of the same session is forgotten. If another
     * session currently owns the endpoint, that session loses it.</p>
     *
     * @param numericId the session's numeric ID
     * @param address   IPv4 or IPv6 address literal
     * @param port      port in [1, 65535]
     * @return true if stored; false if the input is invalid or the session unknown
     */
    boolean updateUdpEndpoint(int numericId, String address, int port);

    /**
     * Removes a session and every index entry it holds.
     *
     * @param numericId the session's numeric ID
     * @return true if removed, false if no such session exists
     */
    boolean removeSession(int numericId);

    /**
     * Removes several sessions.
     *
     * @param sessions the sessions to remove
     * @return the number of sessions actually removed
     */
    int removeSessions(Collection<? extends Session> sessions);

    // ========== Lookup ==========

    /**
     * Finds a session by numeric ID.
     *
     * @param numericId the numeric ID
     * @return the session, or empty if not found
     */
    Optional<Session> lookupByNumericId(int numericId);

    /**
     * Finds a session by its control connection.
     *
     * @param connectionId the connection ID
     * @return the session, or empty if not found
     */
    Optional<Session> lookupByConnectionId(String connectionId);

    /**
     * Finds the session that owns a UDP endpoint.
     *
     * @param address address literal
     * @param port    port
     * @return the session, or empty if not found
     */
    Optional<Session> lookupByUdpEndpoint(String address, int port);

    /**
     * Returns a snapshot of all live sessions.
     *
     * @return unmodifiable collection
     */
    Collection<Session> getAllSessions();

    /**
     * Returns the number of live sessions.
     */
    int size();
}
