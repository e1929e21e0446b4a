package org.abstractica.voicecontrol.handlers;

import org.abstractica.voicecontrol.Session;

import java.nio.ByteBuffer;

/**
 * Receives datagrams whose sender has been matched to a session.
 *
 * <p>Called from the datagram receive thread. The buffer is only valid for
 * the duration of the call.</p>
 */
@FunctionalInterface
public interface DatagramHandler
{
    /**
     * Handles a datagram.
     *
     * @param session the session the datagram is tagged with
     * @param data    the whole datagram, header included
     */
    void onDatagram(Session session, ByteBuffer data);
}
