package org.abstractica.voicecontrol.impl.directory;

import org.abstractica.voicecontrol.DirectoryFullException;
import org.abstractica.voicecontrol.Session;
import org.abstractica.voicecontrol.SessionDirectory;
import org.abstractica.voicecontrol.UdpEndpoint;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.security.SecureRandom;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Default session directory.
 *
 * <p>Session records live in one map keyed by numeric ID. The connection and
 * UDP indices map to numeric IDs, never to records, so a record exists once
 * and the three views cannot drift apart. One read/write lock covers all
 * three maps: mutations take the write lock, lookups the read lock.</p>
 */
public class DefaultSessionDirectory implements SessionDirectory
{
    private static final Logger LOG = LoggerFactory.getLogger(DefaultSessionDirectory.class);
    private static final int SECRET_LENGTH = 32;

    private final Map<Integer, DefaultSession> sessionsById;
    private final Map<String, Integer> idsByConnection;
    private final Map<UdpEndpoint, Integer> idsByUdpEndpoint;
    private final NumericIdAllocator allocator;
    private final SecureRandom random;
    private final Clock clock;

    private final Lock readLock;
    private final Lock writeLock;

    /**
     * Creates a directory using the system UTC clock.
     */
    public DefaultSessionDirectory()
    {
        this(Clock.systemUTC());
    }

    /**
     * Creates a directory.
     *
     * @param clock source of creation and activity timestamps
     */
    public DefaultSessionDirectory(Clock clock)
    {
        this(clock, MIN_NUMERIC_ID, MAX_NUMERIC_ID);
    }

    /**
     * Creates a directory with a narrowed ID range.
     *
     * @param clock source of creation and activity timestamps
     * @param minId lowest ID to hand out (at least 1)
     * @param maxId highest ID to hand out (at most 65535)
     */
    DefaultSessionDirectory(Clock clock, int minId, int maxId)
    {
        Objects.requireNonNull(clock, "clock");
        if (maxId > MAX_NUMERIC_ID)
        {
            throw new IllegalArgumentException("maxId must be <= " + MAX_NUMERIC_ID + ": " + maxId);
        }

        this.sessionsById = new HashMap<>();
        this.idsByConnection = new HashMap<>();
        this.idsByUdpEndpoint = new HashMap<>();
        this.allocator = new NumericIdAllocator(minId, maxId);
        this.random = new SecureRandom();
        this.clock = clock;

        ReadWriteLock lock = new ReentrantReadWriteLock();
        this.readLock = lock.readLock();
        this.writeLock = lock.writeLock();
    }

    // ========== Mutation ==========

    @Override
    public Session createSession(String connectionId, String clientVersion)
    {
        Objects.requireNonNull(connectionId, "connectionId");

        byte[] secret = new byte[SECRET_LENGTH];
        random.nextBytes(secret);

        DefaultSession session;
        writeLock.lock();
        try
        {
            if (idsByConnection.containsKey(connectionId))
            {
                throw new IllegalStateException("Connection already has a session: " + connectionId);
            }

            int numericId = allocator.allocate(sessionsById::containsKey);
            session = new DefaultSession(numericId, connectionId, secret, clock.instant(), clientVersion);
            sessionsById.put(numericId, session);
            idsByConnection.put(connectionId, numericId);
        }
        catch (DirectoryFullException e)
        {
            LOG.warn("Session directory full, refusing connection {}", connectionId);
            throw e;
        }
        finally
        {
            writeLock.unlock();
        }

        LOG.info("Session created: id={}, connection={}, clientVersion={}",
                session.getNumericId(), connectionId, clientVersion);
        return session;
    }

    @Override
    public boolean updateUdpEndpoint(int numericId, String address, int port)
    {
        if (port < 1 || port > 65535)
        {
            LOG.debug("Rejected UDP endpoint for {}: invalid port {}", numericId, port);
            return false;
        }
        Optional<String> canonical = IpLiterals.normalize(address);
        if (canonical.isEmpty())
        {
            LOG.debug("Rejected UDP endpoint for {}: invalid address '{}'", numericId, address);
            return false;
        }
        UdpEndpoint endpoint = new UdpEndpoint(canonical.get(), port);

        writeLock.lock();
        try
        {
            DefaultSession session = sessionsById.get(numericId);
            if (session == null)
            {
                LOG.debug("Rejected UDP endpoint {}: unknown session {}", endpoint, numericId);
                return false;
            }

            UdpEndpoint previous = session.currentEndpoint();
            if (previous != null && !previous.equals(endpoint))
            {
                idsByUdpEndpoint.remove(previous);
                LOG.debug("Session {} rebound: {} -> {}", numericId, previous, endpoint);
            }

            Integer formerOwner = idsByUdpEndpoint.put(endpoint, numericId);
            if (formerOwner != null && formerOwner != numericId)
            {
                DefaultSession evicted = sessionsById.get(formerOwner);
                if (evicted != null)
                {
                    evicted.unbindUdp();
                }
                LOG.info("UDP endpoint {} moved from session {} to session {}",
                        endpoint, formerOwner, numericId);
            }

            session.bindUdp(endpoint, clock.instant());
            return true;
        }
        finally
        {
            writeLock.unlock();
        }
    }

    @Override
    public boolean removeSession(int numericId)
    {
        DefaultSession removed;
        writeLock.lock();
        try
        {
            removed = removeLocked(numericId);
        }
        finally
        {
            writeLock.unlock();
        }

        if (removed == null)
        {
            return false;
        }
        LOG.info("Session removed: id={}, connection={}", numericId, removed.getConnectionId());
        return true;
    }

    @Override
    public int removeSessions(Collection<? extends Session> sessions)
    {
        Objects.requireNonNull(sessions, "sessions");

        // Copy first: the argument may be a live view of this directory.
        List<Session> targets = new ArrayList<>(sessions);
        int removed = 0;
        for (Session session : targets)
        {
            if (removeSession(session.getNumericId()))
            {
                removed++;
            }
        }
        return removed;
    }

    private DefaultSession removeLocked(int numericId)
    {
        DefaultSession session = sessionsById.remove(numericId);
        if (session == null)
        {
            return null;
        }

        idsByConnection.remove(session.getConnectionId());

        UdpEndpoint endpoint = session.currentEndpoint();
        if (endpoint != null)
        {
            idsByUdpEndpoint.remove(endpoint, numericId);
        }
        return session;
    }

    // ========== Lookup ==========

    @Override
    public Optional<Session> lookupByNumericId(int numericId)
    {
        readLock.lock();
        try
        {
            return Optional.ofNullable(sessionsById.get(numericId));
        }
        finally
        {
            readLock.unlock();
        }
    }

    @Override
    public Optional<Session> lookupByConnectionId(String connectionId)
    {
        Objects.requireNonNull(connectionId, "connectionId");

        readLock.lock();
        try
        {
            Integer numericId = idsByConnection.get(connectionId);
            return numericId == null ? Optional.empty() : Optional.of(sessionsById.get(numericId));
        }
        finally
        {
            readLock.unlock();
        }
    }

    @Override
    public Optional<Session> lookupByUdpEndpoint(String address, int port)
    {
        if (port < 1 || port > 65535)
        {
            return Optional.empty();
        }
        Optional<String> canonical = IpLiterals.normalize(address);
        if (canonical.isEmpty())
        {
            return Optional.empty();
        }
        UdpEndpoint endpoint = new UdpEndpoint(canonical.get(), port);

        readLock.lock();
        try
        {
            Integer numericId = idsByUdpEndpoint.get(endpoint);
            return numericId == null ? Optional.empty() : Optional.of(sessionsById.get(numericId));
        }
        finally
        {
            readLock.unlock();
        }
    }

    @Override
    public Collection<Session> getAllSessions()
    {
        readLock.lock();
        try
        {
            return Collections.unmodifiableList(new ArrayList<>(sessionsById.values()));
        }
        finally
        {
            readLock.unlock();
        }
    }

    @Override
    public int size()
    {
        readLock.lock();
        try
        {
            return sessionsById.size();
        }
        finally
        {
            readLock.unlock();
        }
    }

    // ========== Diagnostics ==========

    /**
     * Returns the number of indexed UDP endpoints.
     */
    public int udpEndpointCount()
    {
        readLock.lock();
        try
        {
            return idsByUdpEndpoint.size();
        }
        finally
        {
            readLock.unlock();
        }
    }

    /**
     * Moves the allocation cursor.
     *
     * @param numericId the ID the next allocation scan starts from
     */
    void setNextNumericId(int numericId)
    {
        writeLock.lock();
        try
        {
            allocator.reposition(numericId);
        }
        finally
        {
            writeLock.unlock();
        }
    }
}
