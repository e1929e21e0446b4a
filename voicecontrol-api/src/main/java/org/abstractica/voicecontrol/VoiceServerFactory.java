package org.abstractica.voicecontrol;

import org.abstractica.voicecontrol.handlers.ControlGateway;
import org.abstractica.voicecontrol.handlers.DatagramHandler;
import org.abstractica.voicecontrol.handlers.ErrorHandler;

import java.net.InetAddress;

/**
 * Factory for creating VoiceServer instances.
 *
 * <p>Use the builder to configure the server before creation:</p>
 * <pre>{@code
 * VoiceServer server = new DefaultVoiceServerFactory().builder()
 *     .controlPort(7000)
 *     .datagramPort(7001)
 *     .gateway(gateway)
 *     .datagramHandler(forwarder)
 *     .build();
 * }</pre>
 */
public interface VoiceServerFactory
{
    /**
     * Creates a new server builder.
     *
     * @return a new builder instance
     */
    Builder builder();

    /**
     * Builder for configuring and creating a VoiceServer.
     */
    interface Builder
    {
        /**
         * Sets the TCP port for control connections. 0 picks an ephemeral port.
         *
         * @param port the port number
         * @return this builder
         */
        Builder controlPort(int port);

        /**
         * Sets the UDP port for datagrams. 0 picks an ephemeral port.
         *
         * @param port the port number
         * @return this builder
         */
        Builder datagramPort(int port);

        /**
         * Sets the address to bind both sockets to.
         *
         * <p>Optional. Defaults to all interfaces.</p>
         *
         * @param address the bind address
         * @return this builder
         */
        Builder bindAddress(InetAddress address);

        /**
         * Sets the version string sent in handshake acknowledgements.
         *
         * <p>Optional. Defaults to {@code 1.0.0}.</p>
         *
         * @param version the server version
         * @return this builder
         */
        Builder serverVersion(String version);

        /**
         * Sets the largest accepted control frame payload in bytes.
         *
         * <p>Optional. Defaults to 1 MiB.</p>
         *
         * @param size maximum frame length
         * @return this builder
         */
        Builder maxFrameLength(int size);

        /**
         * Sets the application logic for established connections.
         *
         * @param gateway the gateway
         * @return this builder
         */
        Builder gateway(ControlGateway gateway);

        /**
         * Sets the receiver of datagrams from known sessions.
         *
         * <p>Optional. Defaults to discarding them.</p>
         *
         * @param handler the datagram handler
         * @return this builder
         */
        Builder datagramHandler(DatagramHandler handler);

        /**
         * Sets the handler for gateway failures.
         *
         * <p>Optional. Failures are always logged.</p>
         *
         * @param handler the error handler
         * @return this builder
         */
        Builder errorHandler(ErrorHandler handler);

        /**
         * Builds the server.
         *
         * @return the configured server
         * @throws IllegalStateException if required parameters are missing
         */
        VoiceServer build();
    }
}
