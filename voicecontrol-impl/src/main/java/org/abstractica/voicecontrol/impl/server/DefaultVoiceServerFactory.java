package org.abstractica.voicecontrol.impl.server;

import org.abstractica.voicecontrol.SessionDirectory;
import org.abstractica.voicecontrol.VoiceServer;
import org.abstractica.voicecontrol.VoiceServerFactory;
import org.abstractica.voicecontrol.handlers.ControlGateway;
import org.abstractica.voicecontrol.handlers.DatagramHandler;
import org.abstractica.voicecontrol.handlers.ErrorHandler;
import org.abstractica.voicecontrol.impl.control.ControlConnectionFactory;
import org.abstractica.voicecontrol.impl.directory.DefaultSessionDirectory;
import org.abstractica.voicecontrol.impl.framing.DecodeFailurePolicy;
import org.abstractica.voicecontrol.impl.framing.MessageFramer;
import org.abstractica.voicecontrol.impl.transport.DatagramRouter;

import java.net.InetAddress;
import java.net.InetSocketAddress;
import java.time.Clock;
import java.util.Objects;

/**
 * Default implementation of VoiceServerFactory.
 *
 * <p>Creates DefaultVoiceServer instances using a builder pattern.</p>
 */
public class DefaultVoiceServerFactory implements VoiceServerFactory
{
    @Override
    public DefaultBuilder builder()
    {
        return new DefaultBuilder();
    }

    public static class DefaultBuilder implements Builder
    {
        private int controlPort = -1;
        private int datagramPort = -1;
        private InetAddress bindAddress;
        private String serverVersion = "1.0.0";
        private int maxFrameLength = MessageFramer.DEFAULT_MAX_FRAME_LENGTH;
        private ControlGateway gateway;
        private DatagramHandler datagramHandler = (session, data) -> {};
        private ErrorHandler errorHandler;
        private DecodeFailurePolicy decodeFailurePolicy = DecodeFailurePolicy.SKIP;
        private SessionDirectory directory;
        private Clock clock = Clock.systemUTC();

        @Override
        public DefaultBuilder controlPort(int port)
        {
            this.controlPort = checkPort(port);
            return this;
        }

        @Override
        public DefaultBuilder datagramPort(int port)
        {
            this.datagramPort = checkPort(port);
            return this;
        }

        @Override
        public DefaultBuilder bindAddress(InetAddress address)
        {
            this.bindAddress = address;
            return this;
        }

        @Override
        public DefaultBuilder serverVersion(String version)
        {
            Objects.requireNonNull(version, "version");
            if (version.isBlank())
            {
                throw new IllegalArgumentException("Server version must not be blank");
            }
            this.serverVersion = version;
            return this;
        }

        @Override
        public DefaultBuilder maxFrameLength(int size)
        {
            if (size <= 0)
            {
                throw new IllegalArgumentException("maxFrameLength must be positive: " + size);
            }
            this.maxFrameLength = size;
            return this;
        }

        @Override
        public DefaultBuilder gateway(ControlGateway gateway)
        {
            this.gateway = Objects.requireNonNull(gateway, "gateway");
            return this;
        }

        @Override
        public DefaultBuilder datagramHandler(DatagramHandler handler)
        {
            this.datagramHandler = Objects.requireNonNull(handler, "handler");
            return this;
        }

        @Override
        public DefaultBuilder errorHandler(ErrorHandler handler)
        {
            this.errorHandler = handler;
            return this;
        }

        /**
         * Sets what connections do with undecodable frames.
         *
         * <p>Optional. Defaults to {@link DecodeFailurePolicy#SKIP}.</p>
         *
         * @param policy the policy
         * @return this builder
         */
        public DefaultBuilder decodeFailurePolicy(DecodeFailurePolicy policy)
        {
            this.decodeFailurePolicy = Objects.requireNonNull(policy, "policy");
            return this;
        }

        /**
         * Supplies an existing directory instead of creating one.
         *
         * @param directory the directory to share
         * @return this builder
         */
        public DefaultBuilder directory(SessionDirectory directory)
        {
            this.directory = Objects.requireNonNull(directory, "directory");
            return this;
        }

        /**
         * Sets the clock for session timestamps. Ignored if a directory is supplied.
         *
         * @param clock the clock
         * @return this builder
         */
        public DefaultBuilder clock(Clock clock)
        {
            this.clock = Objects.requireNonNull(clock, "clock");
            return this;
        }

        @Override
        public VoiceServer build()
        {
            if (controlPort < 0)
            {
                throw new IllegalStateException("Control port must be specified");
            }
            if (datagramPort < 0)
            {
                throw new IllegalStateException("Datagram port must be specified");
            }
            if (gateway == null)
            {
                throw new IllegalStateException("Gateway must be specified");
            }

            SessionDirectory sessions = directory != null ? directory : new DefaultSessionDirectory(clock);

            ControlConnectionFactory connectionFactory = new ControlConnectionFactory(
                    sessions,
                    gateway,
                    errorHandler,
                    serverVersion,
                    maxFrameLength,
                    decodeFailurePolicy
            );

            return new DefaultVoiceServer(
                    sessions,
                    socketAddress(controlPort),
                    socketAddress(datagramPort),
                    connectionFactory,
                    new DatagramRouter(sessions, datagramHandler)
            );
        }

        private InetSocketAddress socketAddress(int port)
        {
            return bindAddress != null ? new InetSocketAddress(bindAddress, port) : new InetSocketAddress(port);
        }

        private static int checkPort(int port)
        {
            if (port < 0 || port > 65535)
            {
                throw new IllegalArgumentException("Port must be 0-65535: " + port);
            }
            return port;
        }
    }
}
