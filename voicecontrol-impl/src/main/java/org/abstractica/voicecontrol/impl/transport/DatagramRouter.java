package org.abstractica.voicecontrol.impl.transport;

import org.abstractica.voicecontrol.Session;
import org.abstractica.voicecontrol.SessionDirectory;
import org.abstractica.voicecontrol.handlers.DatagramHandler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.InetSocketAddress;
import java.nio.ByteBuffer;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Matches incoming datagrams to sessions and keeps UDP endpoints current.
 *
 * <p>Datagram header (big-endian, 16 bytes):</p>
 * <pre>
 * [channelId: 2][userId: 2][sequence: 2][timestamp: 4]
 * [signalStrength: 1][frameDuration: 1][audioLength: 2][hmacPrefix: 2]
 * </pre>
 *
 * <p>The user ID is the sender's numeric session ID. Every accepted datagram
 * confirms the sender's endpoint, so a NAT rebind is picked up by the first
 * datagram from the new source.</p>
 */
public class DatagramRouter
{
    private static final Logger LOG = LoggerFactory.getLogger(DatagramRouter.class);

    /**
     * Size of the datagram header in bytes.
     */
    public static final int HEADER_SIZE = 16;

    private static final int USER_ID_OFFSET = 2;

    private final SessionDirectory directory;
    private final DatagramHandler handler;
    private final AtomicLong dropped = new AtomicLong();

    /**
     * Creates a router.
     *
     * @param directory the shared session directory
     * @param handler   receives datagrams from known sessions
     */
    public DatagramRouter(SessionDirectory directory, DatagramHandler handler)
    {
        this.directory = Objects.requireNonNull(directory, "directory");
        this.handler = Objects.requireNonNull(handler, "handler");
    }

    /**
     * Routes one datagram.
     *
     * @param data   the datagram, positioned at its first byte
     * @param source the sender
     * @return true if the datagram was matched to a session and delivered
     */
    public boolean route(ByteBuffer data, InetSocketAddress source)
    {
        Objects.requireNonNull(data, "data");
        Objects.requireNonNull(source, "source");

        if (data.remaining() < HEADER_SIZE)
        {
            return drop("short datagram ({} bytes) from {}", data.remaining(), source);
        }

        int numericId = data.getShort(data.position() + USER_ID_OFFSET) & 0xFFFF;
        if (numericId == 0)
        {
            return drop("datagram with reserved ID 0 from {}", source, null);
        }

        if (source.getAddress() == null)
        {
            return drop("unresolved source {} for session {}", source, numericId);
        }
        String address = source.getAddress().getHostAddress();
        if (!directory.updateUdpEndpoint(numericId, address, source.getPort()))
        {
            return drop("datagram for session {} rejected from {}", numericId, source);
        }

        Optional<Session> session = directory.lookupByNumericId(numericId);
        if (session.isEmpty())
        {
            // Removed between the endpoint update and this lookup.
            return drop("session {} gone before delivery from {}", numericId, source);
        }

        handler.onDatagram(session.get(), data);
        return true;
    }

    /**
     * Returns the number of datagrams dropped so far.
     */
    public long droppedCount()
    {
        return dropped.get();
    }

    private boolean drop(String format, Object arg1, Object arg2)
    {
        dropped.incrementAndGet();
        LOG.debug("Dropped " + format, arg1, arg2);
        return false;
    }
}
