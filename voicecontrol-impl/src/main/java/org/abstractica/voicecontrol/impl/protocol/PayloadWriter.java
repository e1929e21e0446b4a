package org.abstractica.voicecontrol.impl.protocol;

import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;

/**
 * Growable big-endian writer used by {@link PayloadCodec}.
 */
final class PayloadWriter
{
    private final ByteArrayOutputStream out = new ByteArrayOutputStream(64);

    void putString(String value)
    {
        byte[] bytes = value.getBytes(StandardCharsets.UTF_8);
        if (bytes.length > PayloadCodec.MAX_STRING_LENGTH)
        {
            throw new IllegalArgumentException(
                    "String exceeds " + PayloadCodec.MAX_STRING_LENGTH + " bytes: " + bytes.length);
        }
        putUint16(bytes.length);
        out.writeBytes(bytes);
    }

    void putUint16(int value)
    {
        out.write((value >>> 8) & 0xFF);
        out.write(value & 0xFF);
    }

    void putBytes(byte[] bytes)
    {
        out.writeBytes(bytes);
    }

    byte[] toByteArray()
    {
        return out.toByteArray();
    }
}
