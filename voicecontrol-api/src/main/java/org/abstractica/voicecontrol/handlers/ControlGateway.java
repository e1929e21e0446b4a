package org.abstractica.voicecontrol.handlers;

import org.abstractica.voicecontrol.ControlChannel;
import org.abstractica.voicecontrol.Session;
import org.abstractica.voicecontrol.WelcomePayload;
import org.abstractica.voicecontrol.message.ControlMessage;

/**
 * Application logic driven by established control connections.
 *
 * <p>Callbacks for one connection arrive in order on that connection's
 * worker thread. Callbacks for different connections may run concurrently.</p>
 */
public interface ControlGateway
{
    /**
     * Called once the handshake completed and the session exists.
     *
     * @param channel the connection
     * @param session the new session
     * @param welcome the datagram credentials already sent to the client
     */
    default void onEstablished(ControlChannel channel, Session session, WelcomePayload welcome)
    {
    }

    /**
     * Called for every message received after the handshake.
     *
     * @param channel the connection
     * @param session the connection's session
     * @param message the decoded message
     */
    void onMessage(ControlChannel channel, Session session, ControlMessage message);

    /**
     * Called after the session has been removed from the directory.
     *
     * @param session the removed session
     */
    default void onClosed(Session session)
    {
    }
}
