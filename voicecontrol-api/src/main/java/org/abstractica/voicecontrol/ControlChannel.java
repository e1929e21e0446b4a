package org.abstractica.voicecontrol;

import org.abstractica.voicecontrol.message.ControlMessage;

/**
 * The server side of one control connection, as seen by the gateway.
 */
public interface ControlChannel
{
    /**
     * Returns the connection ID, unique among open connections.
     *
     * @return connection ID
     */
    String getConnectionId();

    /**
     * Sends a message to the client.
     *
     * <p>Ignored once the channel is closed.</p>
     *
     * @param message the message to send
     */
    void send(ControlMessage message);

    /**
     * Closes the connection.
     *
     * @param reason why the connection is being closed, for the log
     */
    void close(String reason);

    /**
     * Returns whether the channel is still open.
     */
    boolean isOpen();
}
