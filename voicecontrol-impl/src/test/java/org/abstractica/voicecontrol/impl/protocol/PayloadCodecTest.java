package org.abstractica.voicecontrol.impl.protocol;

import org.abstractica.voicecontrol.message.ControlMessage;
import org.junit.jupiter.api.Test;

import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for {@link PayloadCodec}.
 */
class PayloadCodecTest
{
    // ========== Wire format ==========

    @Test
    void handshake_wireFormat()
    {
        byte[] encoded = PayloadCodec.encode(new ControlMessage.Handshake("1.0"));

        ByteBuffer buffer = ByteBuffer.wrap(encoded);
        assertEquals(9, buffer.getShort()); // "handshake"
        byte[] tag = new byte[9];
        buffer.get(tag);
        assertEquals("handshake", new String(tag, StandardCharsets.UTF_8));
        assertEquals(3, buffer.getShort());
        byte[] version = new byte[3];
        buffer.get(version);
        assertEquals("1.0", new String(version, StandardCharsets.UTF_8));
        assertFalse(buffer.hasRemaining());
    }

    @Test
    void channelJoin_wireFormat()
    {
        byte[] encoded = PayloadCodec.encode(new ControlMessage.ChannelJoin(0xBEEF));

        assertEquals(2 + "channel_join".length() + 2, encoded.length);
        assertEquals((byte) 0xBE, encoded[encoded.length - 2]);
        assertEquals((byte) 0xEF, encoded[encoded.length - 1]);
    }

    @Test
    void allKinds_roundTrip()
    {
        List<ControlMessage> messages = List.of(
                new ControlMessage.Handshake("1.0.0"),
                new ControlMessage.HandshakeAck("abc123", "2.1.0"),
                new ControlMessage.Error("server_full", "Server is full"),
                new ControlMessage.Welcome(65535, "c2VjcmV0"),
                new ControlMessage.UserJoin(7, 3),
                new ControlMessage.UserLeave(7, 3),
                new ControlMessage.ChannelJoin(0),
                new ControlMessage.ChannelLeave(65535),
                new ControlMessage.Unrecognized("user_state", new byte[]{1, 2, 3})
        );

        for (ControlMessage message : messages)
        {
            assertEquals(message, PayloadCodec.decode(PayloadCodec.encode(message)), message.tag());
        }
    }

    @Test
    void unicodeStrings_roundTrip()
    {
        ControlMessage message = new ControlMessage.Error("ü", "Fehler: 語 🎧");

        assertEquals(message, PayloadCodec.decode(PayloadCodec.encode(message)));
    }

    // ========== Unknown kinds ==========

    @Test
    void unknownTag_decodesAsUnrecognized()
    {
        byte[] payload = payload("user_state", new byte[]{9, 8});

        ControlMessage decoded = PayloadCodec.decode(payload);

        ControlMessage.Unrecognized unrecognized = assertInstanceOf(ControlMessage.Unrecognized.class, decoded);
        assertEquals("user_state", unrecognized.type());
        assertArrayEquals(new byte[]{9, 8}, unrecognized.body());
    }

    @Test
    void unrecognized_knownTag_rejected()
    {
        assertThrows(IllegalArgumentException.class,
                () -> new ControlMessage.Unrecognized("handshake", new byte[0]));
    }

    @Test
    void unrecognized_bodyCopiedInAndOut()
    {
        byte[] body = {1, 2, 3};
        ControlMessage.Unrecognized message = new ControlMessage.Unrecognized("user_state", body);
        int hash = message.hashCode();

        body[0] = 9;
        message.body()[1] = 9;

        assertArrayEquals(new byte[]{1, 2, 3}, message.body());
        assertEquals(new ControlMessage.Unrecognized("user_state", new byte[]{1, 2, 3}), message);
        assertEquals(hash, message.hashCode());
    }

    // ========== Malformed payloads ==========

    @Test
    void emptyPayload_malformed()
    {
        assertThrows(MalformedMessageException.class, () -> PayloadCodec.decode(new byte[0]));
    }

    @Test
    void truncatedTag_malformed()
    {
        assertThrows(MalformedMessageException.class, () -> PayloadCodec.decode(new byte[]{0, 10, 'h', 'a'}));
    }

    @Test
    void knownTagMissingField_malformed()
    {
        byte[] payload = payload("handshake", new byte[0]);

        assertThrows(MalformedMessageException.class, () -> PayloadCodec.decode(payload));
    }

    @Test
    void trailingBytes_malformed()
    {
        byte[] valid = PayloadCodec.encode(new ControlMessage.ChannelJoin(5));
        byte[] padded = Arrays.copyOf(valid, valid.length + 1);

        assertThrows(MalformedMessageException.class, () -> PayloadCodec.decode(padded));
    }

    @Test
    void invalidUtf8_malformed()
    {
        byte[] payload = payload("handshake", new byte[]{0, 2, (byte) 0xC3, (byte) 0x28});

        assertThrows(MalformedMessageException.class, () -> PayloadCodec.decode(payload));
    }

    @Test
    void welcomeWithShortSecret_malformed()
    {
        byte[] payload = payload("welcome", new byte[]{0, 1, 0, 5, 'a', 'b'});

        assertThrows(MalformedMessageException.class, () -> PayloadCodec.decode(payload));
    }

    @Test
    void encode_oversizedString_rejected()
    {
        String huge = "x".repeat(PayloadCodec.MAX_STRING_LENGTH + 1);

        assertThrows(IllegalArgumentException.class,
                () -> PayloadCodec.encode(new ControlMessage.Handshake(huge)));
    }

    private static byte[] payload(String tag, byte[] rest)
    {
        byte[] tagBytes = tag.getBytes(StandardCharsets.UTF_8);
        ByteBuffer buffer = ByteBuffer.allocate(2 + tagBytes.length + rest.length);
        buffer.putShort((short) tagBytes.length);
        buffer.put(tagBytes);
        buffer.put(rest);
        return buffer.array();
    }
}
