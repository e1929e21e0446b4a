package org.abstractica.voicecontrol.impl.framing;

/**
 * What a {@link MessageFramer} does with a complete frame whose payload
 * cannot be decoded.
 */
public enum DecodeFailurePolicy
{
    /**
     * Consume the frame, log it, and continue with the next one.
     */
    SKIP,

    /**
     * Consume the frame and throw, so the owner can close the connection.
     */
    FAIL
}
