package org.abstractica.voicecontrol;

import java.net.InetSocketAddress;

/**
 * A running voice control server: a control-connection acceptor, a datagram
 * receiver, and the session directory they share.
 */
public interface VoiceServer extends AutoCloseable
{
    /**
     * Binds both sockets and starts accepting traffic.
     *
     * @throws IllegalStateException if already started
     */
    void start();

    /**
     * Closes all connections and both sockets. Idempotent.
     */
    @Override
    void close();

    /**
     * Returns the session directory owned by this server.
     */
    SessionDirectory getDirectory();

    /**
     * Returns the bound control (TCP) address.
     *
     * @return the address, or null if not started
     */
    InetSocketAddress getControlAddress();

    /**
     * Returns the bound datagram (UDP) address.
     *
     * @return the address, or null if not started
     */
    InetSocketAddress getDatagramAddress();
}
