package org.abstractica.voicecontrol.handlers;

import org.abstractica.voicecontrol.Session;
import org.abstractica.voicecontrol.message.ControlMessage;

/**
 * Handles exceptions thrown by the gateway.
 *
 * <p>When the gateway throws, the library catches it, logs it, and invokes
 * this handler. The connection keeps processing other messages.</p>
 */
@FunctionalInterface
public interface ErrorHandler
{
    /**
     * Handles an exception thrown by the gateway.
     *
     * @param session   the session where the error occurred
     * @param message   the message that caused the error
     * @param exception the exception thrown
     */
    void handle(Session session, ControlMessage message, Exception exception);
}
