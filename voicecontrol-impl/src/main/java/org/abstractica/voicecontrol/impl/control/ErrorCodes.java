package org.abstractica.voicecontrol.impl.control;

/**
 * Codes sent in {@code error} messages.
 */
public final class ErrorCodes
{
    public static final String HANDSHAKE_REQUIRED = "handshake_required";
    public static final String ALREADY_ESTABLISHED = "already_established";
    public static final String SERVER_FULL = "server_full";
    public static final String PROTOCOL_ERROR = "protocol_error";

    private ErrorCodes() {}
}
