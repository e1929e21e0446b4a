package org.abstractica.voicecontrol.impl.control;

import org.abstractica.voicecontrol.ControlChannel;
import org.abstractica.voicecontrol.DirectoryFullException;
import org.abstractica.voicecontrol.Session;
import org.abstractica.voicecontrol.SessionDirectory;
import org.abstractica.voicecontrol.WelcomePayload;
import org.abstractica.voicecontrol.handlers.ControlGateway;
import org.abstractica.voicecontrol.handlers.ErrorHandler;
import org.abstractica.voicecontrol.impl.framing.FrameTooLargeException;
import org.abstractica.voicecontrol.impl.framing.MessageFramer;
import org.abstractica.voicecontrol.impl.protocol.MalformedMessageException;
import org.abstractica.voicecontrol.message.ControlMessage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.List;
import java.util.Objects;

/**
 * Server side of one control connection.
 *
 * <p>Owns the connection's {@link MessageFramer} and drives the handshake:
 * the first message must be a handshake, which creates the session and is
 * answered with an acknowledgement and the welcome credentials. Afterwards
 * every message goes to the {@link ControlGateway}.</p>
 *
 * <p>{@link #onData} and {@link #onClosed} are called by the acceptor from the
 * connection's worker thread. {@link #send} and {@link #close} may be called
 * from any thread.</p>
 */
public class ControlConnection implements ControlChannel
{
    private static final Logger LOG = LoggerFactory.getLogger(ControlConnection.class);

    private final String connectionId;
    private final ControlTransport transport;
    private final MessageFramer framer;
    private final SessionDirectory directory;
    private final ControlGateway gateway;
    private final ErrorHandler errorHandler;
    private final String serverVersion;

    private volatile ControlState state;
    private volatile Session session;

    /**
     * Creates a connection in state {@link ControlState#AWAITING_HANDSHAKE}.
     *
     * <p>Use {@link ControlConnectionFactory} to create instances.</p>
     */
    ControlConnection(
            String connectionId,
            ControlTransport transport,
            MessageFramer framer,
            SessionDirectory directory,
            ControlGateway gateway,
            ErrorHandler errorHandler,
            String serverVersion
    )
    {
        this.connectionId = Objects.requireNonNull(connectionId, "connectionId");
        this.transport = Objects.requireNonNull(transport, "transport");
        this.framer = Objects.requireNonNull(framer, "framer");
        this.directory = Objects.requireNonNull(directory, "directory");
        this.gateway = Objects.requireNonNull(gateway, "gateway");
        this.errorHandler = errorHandler;
        this.serverVersion = Objects.requireNonNull(serverVersion, "serverVersion");
        this.state = ControlState.AWAITING_HANDSHAKE;
    }

    // ========== Inbound ==========

    /**
     * Feeds bytes read from the connection.
     *
     * @param chunk  source array
     * @param offset first byte
     * @param length number of bytes
     */
    public void onData(byte[] chunk, int offset, int length)
    {
        if (state == ControlState.CLOSED)
        {
            return;
        }

        List<ControlMessage> messages;
        try
        {
            messages = framer.addData(chunk, offset, length);
        }
        catch (FrameTooLargeException | MalformedMessageException e)
        {
            protocolError(e);
            return;
        }

        for (ControlMessage message : messages)
        {
            if (state == ControlState.CLOSED)
            {
                return;
            }
            dispatch(message);
        }

        // Messages that preceded a bad frame in this chunk are dispatched first.
        if (state != ControlState.CLOSED && framer.hasPendingFailure())
        {
            try
            {
                framer.checkFailure();
            }
            catch (FrameTooLargeException | MalformedMessageException e)
            {
                protocolError(e);
            }
        }
    }

    private void protocolError(RuntimeException e)
    {
        LOG.warn("Protocol error on {} ({}): {}", connectionId, transport.describePeer(), e.getMessage());
        send(new ControlMessage.Error(ErrorCodes.PROTOCOL_ERROR, e.getMessage()));
        close("protocol error");
    }

    /**
     * Signals that the peer closed the connection or it failed.
     */
    public void onClosed()
    {
        close("connection closed");
    }

    private void dispatch(ControlMessage message)
    {
        LOG.debug("Received {} on {}", message.tag(), connectionId);

        if (state == ControlState.AWAITING_HANDSHAKE)
        {
            if (message instanceof ControlMessage.Handshake handshake)
            {
                establish(handshake);
            }
            else
            {
                LOG.warn("Expected handshake on {}, got {}", connectionId, message.tag());
                send(new ControlMessage.Error(ErrorCodes.HANDSHAKE_REQUIRED,
                        "First message must be a handshake"));
                close("handshake required");
            }
            return;
        }

        if (message instanceof ControlMessage.Handshake)
        {
            send(new ControlMessage.Error(ErrorCodes.ALREADY_ESTABLISHED,
                    "Handshake already completed"));
            return;
        }

        Session current = session;
        try
        {
            gateway.onMessage(this, current, message);
        }
        catch (Exception e)
        {
            reportGatewayError(current, message, e);
        }
    }

    private void establish(ControlMessage.Handshake handshake)
    {
        Session created;
        try
        {
            created = directory.createSession(connectionId, handshake.clientVersion());
        }
        catch (DirectoryFullException e)
        {
            send(new ControlMessage.Error(ErrorCodes.SERVER_FULL, "Server is full"));
            close("server full");
            return;
        }

        synchronized (this)
        {
            if (state == ControlState.CLOSED)
            {
                // Closed concurrently while the session was being created.
                directory.removeSession(created.getNumericId());
                return;
            }
            session = created;
            state = ControlState.ESTABLISHED;
        }

        WelcomePayload welcome = WelcomePayload.of(created);
        send(new ControlMessage.HandshakeAck(connectionId, serverVersion));
        send(new ControlMessage.Welcome(welcome.numericId(), welcome.secret()));

        LOG.info("Connection {} established: session={}, clientVersion={}, peer={}",
                connectionId, created.getNumericId(), handshake.clientVersion(), transport.describePeer());

        try
        {
            gateway.onEstablished(this, created, welcome);
        }
        catch (Exception e)
        {
            reportGatewayError(created, handshake, e);
        }
    }

    private void reportGatewayError(Session current, ControlMessage message, Exception e)
    {
        LOG.error("Gateway error: connection={}, messageType={}", connectionId, message.tag(), e);
        if (errorHandler != null)
        {
            try
            {
                errorHandler.handle(current, message, e);
            }
            catch (Exception e2)
            {
                LOG.error("Error handler threw exception", e2);
            }
        }
    }

    // ========== ControlChannel ==========

    @Override
    public String getConnectionId()
    {
        return connectionId;
    }

    @Override
    public void send(ControlMessage message)
    {
        Objects.requireNonNull(message, "message");
        if (state == ControlState.CLOSED)
        {
            LOG.debug("Dropping {} for closed connection {}", message.tag(), connectionId);
            return;
        }

        byte[] frame = framer.encode(message);
        try
        {
            transport.write(frame);
        }
        catch (IOException e)
        {
            LOG.warn("Write failed on {}: {}", connectionId, e.getMessage());
            close("write failed");
        }
    }

    @Override
    public void close(String reason)
    {
        Session released;
        synchronized (this)
        {
            if (state == ControlState.CLOSED)
            {
                return;
            }
            state = ControlState.CLOSED;
            released = session;
        }

        LOG.debug("Closing connection {}: {}", connectionId, reason);
        transport.close();

        if (released != null)
        {
            directory.removeSession(released.getNumericId());
            try
            {
                gateway.onClosed(released);
            }
            catch (Exception e)
            {
                LOG.error("Gateway close callback error: connection={}", connectionId, e);
            }
        }
    }

    @Override
    public boolean isOpen()
    {
        return state != ControlState.CLOSED;
    }

    // ========== Accessors ==========

    /**
     * Returns the current handshake state.
     */
    public ControlState getState()
    {
        return state;
    }

    /**
     * Returns the session once established.
     *
     * @return the session, or null before the handshake
     */
    public Session getSession()
    {
        return session;
    }
}
