package org.abstractica.voicecontrol.message;

import java.util.Objects;
import java.util.Optional;

/**
 * Discriminant tags of the control-channel message kinds.
 */
public enum MessageType
{
    // Handshake (core)
    HANDSHAKE("handshake"),
    HANDSHAKE_ACK("handshake_ack"),
    ERROR("error"),

    // Session bootstrap
    WELCOME("welcome"),

    // Reserved for the gateway
    USER_JOIN("user_join"),
    USER_LEAVE("user_leave"),
    CHANNEL_JOIN("channel_join"),
    CHANNEL_LEAVE("channel_leave");

    private final String tag;

    MessageType(String tag)
    {
        this.tag = tag;
    }

    /**
     * Returns the wire tag for this kind.
     *
     * @return the tag string
     */
    public String getTag()
    {
        return tag;
    }

    /**
     * Looks up a message kind by its wire tag.
     *
     * @param tag the tag string
     * @return the kind, or empty if the tag is not a known kind
     */
    public static Optional<MessageType> fromTag(String tag)
    {
        Objects.requireNonNull(tag, "tag");
        for (MessageType type : values())
        {
            if (type.tag.equals(tag))
            {
                return Optional.of(type);
            }
        }
        return Optional.empty();
    }
}
