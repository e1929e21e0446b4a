package org.abstractica.voicecontrol.impl.control;

/**
 * State of a control connection.
 */
public enum ControlState
{
    /**
     * Connection accepted; the first message must be a handshake.
     */
    AWAITING_HANDSHAKE,

    /**
     * Handshake done and session created. The gateway receives messages.
     */
    ESTABLISHED,

    /**
     * Connection closed and session removed. Terminal.
     */
    CLOSED
}
