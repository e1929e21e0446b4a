package org.abstractica.voicecontrol.impl.protocol;

import org.abstractica.voicecontrol.message.ControlMessage;
import org.abstractica.voicecontrol.message.MessageType;

import java.nio.BufferUnderflowException;
import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.util.Objects;
import java.util.Optional;

/**
 * Encodes and decodes control message payloads.
 *
 * <p>Wire format (big-endian):</p>
 * <pre>
 * [tagLength: 2 bytes][tag: UTF-8]
 * [fields in declaration order]
 * </pre>
 *
 * <p>Strings are a 2-byte length followed by UTF-8 bytes; uint16 fields are
 * 2 bytes. The body of an {@link ControlMessage.Unrecognized} message is
 * every byte after the tag.</p>
 */
public final class PayloadCodec
{
    /**
     * Maximum encoded string length in bytes (2-byte length field).
     */
    public static final int MAX_STRING_LENGTH = 65535;

    private PayloadCodec() {}

    // ========== Encoding ==========

    /**
     * Encodes a message payload.
     *
     * @param message the message to encode
     * @return payload bytes, without a frame header
     * @throws IllegalArgumentException if a string field is too long
     */
    public static byte[] encode(ControlMessage message)
    {
        Objects.requireNonNull(message, "message");

        PayloadWriter writer = new PayloadWriter();
        writer.putString(message.tag());

        if (message instanceof ControlMessage.Handshake m)
        {
            writer.putString(m.clientVersion());
        }
        else if (message instanceof ControlMessage.HandshakeAck m)
        {
            writer.putString(m.connectionId());
            writer.putString(m.serverVersion());
        }
        else if (message instanceof ControlMessage.Error m)
        {
            writer.putString(m.code());
            writer.putString(m.message());
        }
        else if (message instanceof ControlMessage.Welcome m)
        {
            writer.putUint16(m.numericId());
            writer.putString(m.secret());
        }
        else if (message instanceof ControlMessage.UserJoin m)
        {
            writer.putUint16(m.numericId());
            writer.putUint16(m.channelId());
        }
        else if (message instanceof ControlMessage.UserLeave m)
        {
            writer.putUint16(m.numericId());
            writer.putUint16(m.channelId());
        }
        else if (message instanceof ControlMessage.ChannelJoin m)
        {
            writer.putUint16(m.channelId());
        }
        else if (message instanceof ControlMessage.ChannelLeave m)
        {
            writer.putUint16(m.channelId());
        }
        else if (message instanceof ControlMessage.Unrecognized m)
        {
            writer.putBytes(m.body());
        }

        return writer.toByteArray();
    }

    // ========== Decoding ==========

    /**
     * Decodes a message payload.
     *
     * @param payload the payload bytes, without a frame header
     * @return the decoded message
     * @throws MalformedMessageException if the payload is truncated, has
     *                                   trailing bytes, invalid UTF-8 or
     *                                   invalid field values
     */
    public static ControlMessage decode(byte[] payload)
    {
        Objects.requireNonNull(payload, "payload");
        return decode(ByteBuffer.wrap(payload));
    }

    /**
     * Decodes a message payload, consuming every remaining byte of the buffer.
     *
     * @param buffer the buffer to read from
     * @return the decoded message
     * @throws MalformedMessageException if the payload is malformed
     */
    public static ControlMessage decode(ByteBuffer buffer)
    {
        try
        {
            String tag = readString(buffer);
            Optional<MessageType> type = MessageType.fromTag(tag);
            if (type.isEmpty())
            {
                byte[] body = new byte[buffer.remaining()];
                buffer.get(body);
                return new ControlMessage.Unrecognized(tag, body);
            }

            ControlMessage message = switch (type.get())
            {
                case HANDSHAKE -> new ControlMessage.Handshake(readString(buffer));
                case HANDSHAKE_ACK -> new ControlMessage.HandshakeAck(readString(buffer), readString(buffer));
                case ERROR -> new ControlMessage.Error(readString(buffer), readString(buffer));
                case WELCOME -> new ControlMessage.Welcome(readUint16(buffer), readString(buffer));
                case USER_JOIN -> new ControlMessage.UserJoin(readUint16(buffer), readUint16(buffer));
                case USER_LEAVE -> new ControlMessage.UserLeave(readUint16(buffer), readUint16(buffer));
                case CHANNEL_JOIN -> new ControlMessage.ChannelJoin(readUint16(buffer));
                case CHANNEL_LEAVE -> new ControlMessage.ChannelLeave(readUint16(buffer));
            };

            if (buffer.hasRemaining())
            {
                throw new MalformedMessageException(
                        buffer.remaining() + " trailing bytes after " + tag + " payload");
            }
            return message;
        }
        catch (BufferUnderflowException e)
        {
            throw new MalformedMessageException("Truncated payload", e);
        }
        catch (IllegalArgumentException e)
        {
            throw new MalformedMessageException("Invalid field value: " + e.getMessage(), e);
        }
    }

    private static String readString(ByteBuffer buffer)
    {
        int length = buffer.getShort() & 0xFFFF;
        if (length > buffer.remaining())
        {
            throw new BufferUnderflowException();
        }

        ByteBuffer slice = buffer.slice();
        slice.limit(length);
        buffer.position(buffer.position() + length);

        CharsetDecoder decoder = StandardCharsets.UTF_8.newDecoder()
                .onMalformedInput(CodingErrorAction.REPORT)
                .onUnmappableCharacter(CodingErrorAction.REPORT);
        try
        {
            return decoder.decode(slice).toString();
        }
        catch (CharacterCodingException e)
        {
            throw new MalformedMessageException("Invalid UTF-8 in string field", e);
        }
    }

    private static int readUint16(ByteBuffer buffer)
    {
        return buffer.getShort() & 0xFFFF;
    }
}
