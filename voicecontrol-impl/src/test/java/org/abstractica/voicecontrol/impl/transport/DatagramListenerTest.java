package org.abstractica.voicecontrol.impl.transport;

import org.abstractica.voicecontrol.Session;
import org.abstractica.voicecontrol.impl.directory.DefaultSessionDirectory;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.net.DatagramPacket;
import java.net.DatagramSocket;
import java.net.InetAddress;
import java.net.InetSocketAddress;
import java.nio.ByteBuffer;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for {@link DatagramListener}.
 */
class DatagramListenerTest
{
    private static final long TIMEOUT_MS = 5000;

    private DefaultSessionDirectory directory;
    private BlockingQueue<Integer> payloadSizes;
    private AtomicBoolean failNext;
    private DatagramListener listener;
    private DatagramSocket sender;

    @BeforeEach
    void setUp() throws IOException
    {
        directory = new DefaultSessionDirectory();
        payloadSizes = new LinkedBlockingQueue<>();
        failNext = new AtomicBoolean();
        DatagramRouter router = new DatagramRouter(directory, (session, data) ->
        {
            if (failNext.getAndSet(false))
            {
                throw new IllegalStateException("handler failure");
            }
            payloadSizes.add(data.remaining());
        });

        listener = new DatagramListener(new InetSocketAddress(InetAddress.getLoopbackAddress(), 0), router);
        listener.start();
        sender = new DatagramSocket(0, InetAddress.getLoopbackAddress());
    }

    @AfterEach
    void tearDown()
    {
        sender.close();
        listener.close();
    }

    @Test
    void datagram_routedWithFullLength() throws Exception
    {
        Session session = directory.createSession("conn-1");

        send(session.getNumericId(), 40);

        assertEquals(DatagramRouter.HEADER_SIZE + 40, payloadSizes.poll(TIMEOUT_MS, TimeUnit.MILLISECONDS));
        assertEquals(sender.getLocalPort(), session.getUdpEndpoint().orElseThrow().port());
        assertEquals(1, listener.receivedCount());
    }

    @Test
    void routingFailure_countedAndReadingContinues() throws Exception
    {
        Session session = directory.createSession("conn-1");
        failNext.set(true);

        send(session.getNumericId(), 1);
        send(session.getNumericId(), 2);

        assertEquals(DatagramRouter.HEADER_SIZE + 2, payloadSizes.poll(TIMEOUT_MS, TimeUnit.MILLISECONDS));
        assertEquals(1, listener.routingFailureCount());
    }

    @Test
    void start_twice_rejected()
    {
        assertThrows(IllegalStateException.class, listener::start);
    }

    @Test
    void close_keepsBoundAddressAndIsIdempotent()
    {
        InetSocketAddress bound = listener.getLocalAddress();
        assertTrue(bound.getPort() > 0);

        listener.close();
        listener.close();

        assertEquals(bound, listener.getLocalAddress());
    }

    private void send(int numericId, int audioBytes) throws IOException
    {
        byte[] packet = new byte[DatagramRouter.HEADER_SIZE + audioBytes];
        ByteBuffer.wrap(packet).putShort(2, (short) numericId);
        sender.send(new DatagramPacket(packet, packet.length, listener.getLocalAddress()));
    }
}
