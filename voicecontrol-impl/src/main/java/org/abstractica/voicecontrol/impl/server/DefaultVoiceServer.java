package org.abstractica.voicecontrol.impl.server;

import org.abstractica.voicecontrol.SessionDirectory;
import org.abstractica.voicecontrol.VoiceServer;
import org.abstractica.voicecontrol.impl.control.ControlConnectionFactory;
import org.abstractica.voicecontrol.impl.transport.ControlListener;
import org.abstractica.voicecontrol.impl.transport.DatagramListener;
import org.abstractica.voicecontrol.impl.transport.DatagramRouter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.InetSocketAddress;
import java.util.Objects;

/**
 * Default implementation of the VoiceServer interface.
 *
 * <p>Owns the session directory and hands the same instance to the control
 * acceptor and to the datagram path.</p>
 */
public class DefaultVoiceServer implements VoiceServer
{
    private static final Logger LOG = LoggerFactory.getLogger(DefaultVoiceServer.class);

    private final SessionDirectory directory;
    private final ControlListener controlListener;
    private final DatagramListener datagramListener;

    private volatile boolean running;

    /**
     * Creates a new server.
     *
     * <p>Use {@link DefaultVoiceServerFactory} to create instances.</p>
     */
    DefaultVoiceServer(
            SessionDirectory directory,
            InetSocketAddress controlAddress,
            InetSocketAddress datagramAddress,
            ControlConnectionFactory connectionFactory,
            DatagramRouter router
    )
    {
        this.directory = Objects.requireNonNull(directory, "directory");
        this.controlListener = new ControlListener(controlAddress, connectionFactory);
        this.datagramListener = new DatagramListener(datagramAddress, router);
    }

    @Override
    public void start()
    {
        if (running)
        {
            throw new IllegalStateException("Server already started");
        }

        LOG.info("Starting voice server");

        datagramListener.start();
        try
        {
            controlListener.start();
        }
        catch (RuntimeException e)
        {
            datagramListener.close();
            throw e;
        }
        running = true;

        LOG.info("Voice server started: control={}, datagram={}",
                controlListener.getLocalAddress(), datagramListener.getLocalAddress());
    }

    @Override
    public void close()
    {
        if (!running)
        {
            return;
        }
        running = false;

        LOG.info("Closing voice server");

        controlListener.close();
        datagramListener.close();

        int remaining = directory.size();
        if (remaining > 0)
        {
            LOG.warn("{} sessions still registered after shutdown", remaining);
        }

        LOG.info("Voice server closed");
    }

    @Override
    public SessionDirectory getDirectory()
    {
        return directory;
    }

    @Override
    public InetSocketAddress getControlAddress()
    {
        return controlListener.getLocalAddress();
    }

    @Override
    public InetSocketAddress getDatagramAddress()
    {
        return datagramListener.getLocalAddress();
    }

    /**
     * Returns the number of open control connections.
     */
    public int getConnectionCount()
    {
        return controlListener.getConnectionCount();
    }
}
