package org.abstractica.voicecontrol.impl.control;

import java.io.IOException;

/**
 * Byte-level side of a control connection, supplied by the acceptor.
 */
public interface ControlTransport
{
    /**
     * Writes bytes to the peer. Implementations serialize concurrent writers.
     *
     * @param bytes the bytes to write
     * @throws IOException if the write fails
     */
    void write(byte[] bytes) throws IOException;

    /**
     * Closes the underlying connection. Idempotent.
     */
    void close();

    /**
     * Describes the peer for log messages.
     */
    String describePeer();
}
