package org.abstractica.voicecontrol.impl.transport;

import org.abstractica.voicecontrol.impl.control.ControlTransport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.OutputStream;
import java.net.Socket;
import java.util.Objects;

/**
 * {@link ControlTransport} over a connected TCP socket.
 */
final class SocketControlTransport implements ControlTransport
{
    private static final Logger LOG = LoggerFactory.getLogger(SocketControlTransport.class);

    private final Socket socket;
    private final OutputStream out;
    private final Object writeLock = new Object();

    SocketControlTransport(Socket socket) throws IOException
    {
        this.socket = Objects.requireNonNull(socket, "socket");
        this.out = socket.getOutputStream();
    }

    @Override
    public void write(byte[] bytes) throws IOException
    {
        synchronized (writeLock)
        {
            out.write(bytes);
            out.flush();
        }
    }

    @Override
    public void close()
    {
        try
        {
            socket.close();
        }
        catch (IOException e)
        {
            LOG.debug("Error closing socket {}: {}", socket.getRemoteSocketAddress(), e.getMessage());
        }
    }

    @Override
    public String describePeer()
    {
        return String.valueOf(socket.getRemoteSocketAddress());
    }
}
