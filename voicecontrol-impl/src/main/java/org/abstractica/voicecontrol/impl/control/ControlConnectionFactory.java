package org.abstractica.voicecontrol.impl.control;

import org.abstractica.voicecontrol.SessionDirectory;
import org.abstractica.voicecontrol.handlers.ControlGateway;
import org.abstractica.voicecontrol.handlers.ErrorHandler;
import org.abstractica.voicecontrol.impl.framing.DecodeFailurePolicy;
import org.abstractica.voicecontrol.impl.framing.MessageFramer;

import java.security.SecureRandom;
import java.util.HexFormat;
import java.util.Objects;

/**
 * Creates a {@link ControlConnection}, with its own framer and a fresh
 * connection ID, for each accepted connection.
 */
public class ControlConnectionFactory
{
    private static final int CONNECTION_ID_LENGTH = 16;

    private final SessionDirectory directory;
    private final ControlGateway gateway;
    private final ErrorHandler errorHandler;
    private final String serverVersion;
    private final int maxFrameLength;
    private final DecodeFailurePolicy failurePolicy;
    private final SecureRandom random;

    /**
     * Creates a factory.
     *
     * @param directory      the shared session directory
     * @param gateway        receives established-connection traffic
     * @param errorHandler   notified of gateway failures, may be null
     * @param serverVersion  version string sent in handshake acknowledgements
     * @param maxFrameLength per-connection frame limit
     * @param failurePolicy  per-connection handling of undecodable frames
     */
    public ControlConnectionFactory(
            SessionDirectory directory,
            ControlGateway gateway,
            ErrorHandler errorHandler,
            String serverVersion,
            int maxFrameLength,
            DecodeFailurePolicy failurePolicy
    )
    {
        this.directory = Objects.requireNonNull(directory, "directory");
        this.gateway = Objects.requireNonNull(gateway, "gateway");
        this.errorHandler = errorHandler;
        this.serverVersion = Objects.requireNonNull(serverVersion, "serverVersion");
        this.maxFrameLength = maxFrameLength;
        this.failurePolicy = Objects.requireNonNull(failurePolicy, "failurePolicy");
        this.random = new SecureRandom();
    }

    /**
     * Creates the connection object for a newly accepted transport.
     *
     * @param transport the accepted connection
     * @return a connection awaiting its handshake
     */
    public ControlConnection create(ControlTransport transport)
    {
        return new ControlConnection(
                generateConnectionId(),
                transport,
                new MessageFramer(maxFrameLength, failurePolicy),
                directory,
                gateway,
                errorHandler,
                serverVersion
        );
    }

    /**
     * Generates a new random connection ID.
     *
     * @return 32 hex characters
     */
    public String generateConnectionId()
    {
        byte[] id = new byte[CONNECTION_ID_LENGTH];
        random.nextBytes(id);
        return HexFormat.of().formatHex(id);
    }
}
