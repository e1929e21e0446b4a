package org.abstractica.voicecontrol.impl.server;

import org.abstractica.voicecontrol.ControlChannel;
import org.abstractica.voicecontrol.Session;
import org.abstractica.voicecontrol.UdpEndpoint;
import org.abstractica.voicecontrol.VoiceServer;
import org.abstractica.voicecontrol.handlers.ControlGateway;
import org.abstractica.voicecontrol.impl.control.ErrorCodes;
import org.abstractica.voicecontrol.impl.framing.MessageFramer;
import org.abstractica.voicecontrol.impl.transport.DatagramRouter;
import org.abstractica.voicecontrol.message.ControlMessage;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.DataInputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.net.DatagramPacket;
import java.net.DatagramSocket;
import java.net.InetAddress;
import java.net.Socket;
import java.nio.ByteBuffer;
import java.util.List;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.function.BooleanSupplier;

import static org.junit.jupiter.api.Assertions.*;

/**
 * End-to-end tests for {@link DefaultVoiceServer} over loopback sockets.
 */
class DefaultVoiceServerTest
{
    private static final long TIMEOUT_MS = 5000;

    private final BlockingQueue<ControlMessage> gatewayMessages = new LinkedBlockingQueue<>();
    private final BlockingQueue<Session> datagramSessions = new LinkedBlockingQueue<>();
    private final BlockingQueue<Session> closedSessions = new LinkedBlockingQueue<>();

    private VoiceServer server;
    private Socket client;
    private DataInputStream in;
    private OutputStream out;
    private final MessageFramer framer = new MessageFramer();

    @BeforeEach
    void setUp() throws IOException
    {
        server = new DefaultVoiceServerFactory().builder()
                .bindAddress(InetAddress.getLoopbackAddress())
                .controlPort(0)
                .datagramPort(0)
                .serverVersion("test-1")
                .gateway(new ControlGateway()
                {
                    @Override
                    public void onMessage(ControlChannel channel, Session session, ControlMessage message)
                    {
                        gatewayMessages.add(message);
                        if (message instanceof ControlMessage.ChannelJoin join)
                        {
                            session.getSubscribedChannels().add(join.channelId());
                            channel.send(new ControlMessage.UserJoin(session.getNumericId(), join.channelId()));
                        }
                    }

                    @Override
                    public void onClosed(Session session)
                    {
                        closedSessions.add(session);
                    }
                })
                .datagramHandler((session, data) -> datagramSessions.add(session))
                .build();
        server.start();

        client = new Socket(InetAddress.getLoopbackAddress(), server.getControlAddress().getPort());
        client.setSoTimeout((int) TIMEOUT_MS);
        in = new DataInputStream(client.getInputStream());
        out = client.getOutputStream();
    }

    @AfterEach
    void tearDown() throws IOException
    {
        client.close();
        server.close();
    }

    @Test
    void handshake_overTcp_establishesSession() throws Exception
    {
        send(new ControlMessage.Handshake("client-1"));

        ControlMessage.HandshakeAck ack = assertInstanceOf(ControlMessage.HandshakeAck.class, read());
        assertEquals("test-1", ack.serverVersion());
        ControlMessage.Welcome welcome = assertInstanceOf(ControlMessage.Welcome.class, read());

        Session session = server.getDirectory().lookupByNumericId(welcome.numericId()).orElseThrow();
        assertEquals(ack.connectionId(), session.getConnectionId());
        assertEquals("client-1", session.getClientVersion().orElseThrow());
    }

    @Test
    void messageBeforeHandshake_errorAndDisconnect() throws Exception
    {
        send(new ControlMessage.ChannelJoin(1));

        ControlMessage.Error error = assertInstanceOf(ControlMessage.Error.class, read());
        assertEquals(ErrorCodes.HANDSHAKE_REQUIRED, error.code());
        assertEquals(-1, in.read());
        assertEquals(0, server.getDirectory().size());
    }

    @Test
    void establishedMessage_reachesGatewayAndReply() throws Exception
    {
        ControlMessage.Welcome welcome = handshake();

        send(new ControlMessage.ChannelJoin(12));

        assertEquals(new ControlMessage.ChannelJoin(12), gatewayMessages.poll(TIMEOUT_MS, TimeUnit.MILLISECONDS));
        assertEquals(new ControlMessage.UserJoin(welcome.numericId(), 12), read());
    }

    @Test
    void datagram_learnsEndpointAndDelivers() throws Exception
    {
        ControlMessage.Welcome welcome = handshake();

        try (DatagramSocket udp = new DatagramSocket(0, InetAddress.getLoopbackAddress()))
        {
            byte[] packet = new byte[DatagramRouter.HEADER_SIZE + 10];
            ByteBuffer.wrap(packet).putShort(2, (short) welcome.numericId());
            udp.send(new DatagramPacket(packet, packet.length, server.getDatagramAddress()));

            Session session = datagramSessions.poll(TIMEOUT_MS, TimeUnit.MILLISECONDS);
            assertNotNull(session);
            assertEquals(welcome.numericId(), session.getNumericId());

            UdpEndpoint endpoint = session.getUdpEndpoint().orElseThrow();
            assertEquals(udp.getLocalPort(), endpoint.port());
            assertSame(session, server.getDirectory()
                    .lookupByUdpEndpoint(endpoint.address(), endpoint.port()).orElseThrow());
        }
    }

    @Test
    void clientDisconnect_removesSession() throws Exception
    {
        ControlMessage.Welcome welcome = handshake();

        client.close();

        Session closed = closedSessions.poll(TIMEOUT_MS, TimeUnit.MILLISECONDS);
        assertNotNull(closed);
        assertEquals(welcome.numericId(), closed.getNumericId());
        awaitCondition(() -> server.getDirectory().size() == 0);
    }

    @Test
    void close_disconnectsClientsAndReleasesSessions() throws Exception
    {
        handshake();

        server.close();

        assertEquals(-1, in.read());
        assertEquals(0, server.getDirectory().size());
    }

    @Test
    void build_missingGateway_rejected()
    {
        DefaultVoiceServerFactory.DefaultBuilder builder = new DefaultVoiceServerFactory().builder()
                .controlPort(0)
                .datagramPort(0);

        assertThrows(IllegalStateException.class, builder::build);
    }

    @Test
    void builder_invalidPort_rejected()
    {
        DefaultVoiceServerFactory.DefaultBuilder builder = new DefaultVoiceServerFactory().builder();

        assertThrows(IllegalArgumentException.class, () -> builder.controlPort(65536));
        assertThrows(IllegalArgumentException.class, () -> builder.datagramPort(-1));
    }

    // ========== Helpers ==========

    private ControlMessage.Welcome handshake() throws IOException
    {
        send(new ControlMessage.Handshake("client-1"));
        assertInstanceOf(ControlMessage.HandshakeAck.class, read());
        return assertInstanceOf(ControlMessage.Welcome.class, read());
    }

    private void send(ControlMessage message) throws IOException
    {
        out.write(framer.encode(message));
        out.flush();
    }

    private ControlMessage read() throws IOException
    {
        int length = in.readInt();
        byte[] frame = ByteBuffer.allocate(MessageFramer.HEADER_LENGTH + length).putInt(length).array();
        in.readFully(frame, MessageFramer.HEADER_LENGTH, length);

        List<ControlMessage> messages = new MessageFramer().addData(frame);
        assertEquals(1, messages.size());
        return messages.get(0);
    }

    private static void awaitCondition(BooleanSupplier condition) throws InterruptedException
    {
        long deadline = System.currentTimeMillis() + TIMEOUT_MS;
        while (!condition.getAsBoolean())
        {
            if (System.currentTimeMillis() > deadline)
            {
                fail("Condition not met within " + TIMEOUT_MS + " ms");
            }
            Thread.sleep(10);
        }
    }
}
