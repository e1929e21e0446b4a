package org.abstractica.voicecontrol.message;

import java.util.Arrays;
import java.util.HexFormat;
import java.util.Objects;

/**
 * Messages carried on the control channel.
 *
 * <p>The set of kinds is closed. A payload whose tag is not a known kind is
 * represented as {@link Unrecognized} rather than rejected, so the gateway
 * can decide what to do with it.</p>
 */
public sealed interface ControlMessage permits
        ControlMessage.Handshake,
        ControlMessage.HandshakeAck,
        ControlMessage.Error,
        ControlMessage.Welcome,
        ControlMessage.UserJoin,
        ControlMessage.UserLeave,
        ControlMessage.ChannelJoin,
        ControlMessage.ChannelLeave,
        ControlMessage.Unrecognized
{
    /**
     * Returns the wire tag of this message.
     *
     * @return the tag string
     */
    String tag();

    /**
     * First message from a client, announcing its version.
     *
     * @param clientVersion the client's version string
     */
    record Handshake(String clientVersion) implements ControlMessage
    {
        public Handshake
        {
            Objects.requireNonNull(clientVersion, "clientVersion");
        }

        @Override
        public String tag()
        {
            return MessageType.HANDSHAKE.getTag();
        }
    }

    /**
     * Server's reply to a handshake.
     *
     * @param connectionId  the ID of the control connection
     * @param serverVersion the server's version string
     */
    record HandshakeAck(String connectionId, String serverVersion) implements ControlMessage
    {
        public HandshakeAck
        {
            Objects.requireNonNull(connectionId, "connectionId");
            Objects.requireNonNull(serverVersion, "serverVersion");
        }

        @Override
        public String tag()
        {
            return MessageType.HANDSHAKE_ACK.getTag();
        }
    }

    /**
     * An error report.
     *
     * @param code    machine-readable error code
     * @param message human-readable description
     */
    record Error(String code, String message) implements ControlMessage
    {
        public Error
        {
            Objects.requireNonNull(code, "code");
            Objects.requireNonNull(message, "message");
        }

        @Override
        public String tag()
        {
            return MessageType.ERROR.getTag();
        }
    }

    /**
     * Datagram credentials for a new session.
     *
     * @param numericId the session's numeric ID
     * @param secret    the session secret, base64 encoded
     */
    record Welcome(int numericId, String secret) implements ControlMessage
    {
        public Welcome
        {
            requireUint16(numericId, "numericId");
            Objects.requireNonNull(secret, "secret");
        }

        @Override
        public String tag()
        {
            return MessageType.WELCOME.getTag();
        }
    }

    /**
     * A participant joined a channel.
     *
     * @param numericId the participant's numeric ID
     * @param channelId the channel
     */
    record UserJoin(int numericId, int channelId) implements ControlMessage
    {
        public UserJoin
        {
            requireUint16(numericId, "numericId");
            requireUint16(channelId, "channelId");
        }

        @Override
        public String tag()
        {
            return MessageType.USER_JOIN.getTag();
        }
    }

    /**
     * A participant left a channel.
     *
     * @param numericId the participant's numeric ID
     * @param channelId the channel
     */
    record UserLeave(int numericId, int channelId) implements ControlMessage
    {
        public UserLeave
        {
            requireUint16(numericId, "numericId");
            requireUint16(channelId, "channelId");
        }

        @Override
        public String tag()
        {
            return MessageType.USER_LEAVE.getTag();
        }
    }

    /**
     * Request to join a channel.
     *
     * @param channelId the channel
     */
    record ChannelJoin(int channelId) implements ControlMessage
    {
        public ChannelJoin
        {
            requireUint16(channelId, "channelId");
        }

        @Override
        public String tag()
        {
            return MessageType.CHANNEL_JOIN.getTag();
        }
    }

    /**
     * Request to leave a channel.
     *
     * @param channelId the channel
     */
    record ChannelLeave(int channelId) implements ControlMessage
    {
        public ChannelLeave
        {
            requireUint16(channelId, "channelId");
        }

        @Override
        public String tag()
        {
            return MessageType.CHANNEL_LEAVE.getTag();
        }
    }

    /**
     * A well-formed payload whose tag is not a known kind.
     *
     * @param type the tag as received
     * @param body every payload byte after the tag
     */
    record Unrecognized(String type, byte[] body) implements ControlMessage
    {
        public Unrecognized
        {
            Objects.requireNonNull(type, "type");
            Objects.requireNonNull(body, "body");
            if (MessageType.fromTag(type).isPresent())
            {
                throw new IllegalArgumentException("Tag is a known kind: " + type);
            }
            body = body.clone();
        }

        /**
         * Returns a copy of the body bytes.
         */
        @Override
        public byte[] body()
        {
            return body.clone();
        }

        @Override
        public String tag()
        {
            return type;
        }

        @Override
        public boolean equals(Object o)
        {
            return o instanceof Unrecognized other
                    && type.equals(other.type)
                    && Arrays.equals(body, other.body);
        }

        @Override
        public int hashCode()
        {
            return 31 * type.hashCode() + Arrays.hashCode(body);
        }

        @Override
        public String toString()
        {
            return "Unrecognized[type=" + type + ", body=" + HexFormat.of().formatHex(body) + "]";
        }
    }

    private static void requireUint16(int value, String name)
    {
        if (value < 0 || value > 0xFFFF)
        {
            throw new IllegalArgumentException(name + " must be 0-65535: " + value);
        }
    }
}
