package org.abstractica.voicecontrol.impl.transport;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.net.InetSocketAddress;
import java.nio.ByteBuffer;
import java.nio.channels.ClosedChannelException;
import java.nio.channels.DatagramChannel;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Voice datagram socket.
 *
 * <p>A blocking {@link DatagramChannel} is read by one daemon thread, which
 * hands every datagram to the {@link DatagramRouter}. Closing the channel
 * unblocks the pending receive and ends the thread.</p>
 */
public class DatagramListener implements AutoCloseable
{
    private static final Logger LOG = LoggerFactory.getLogger(DatagramListener.class);

    /**
     * Largest possible UDP payload.
     */
    public static final int MAX_DATAGRAM_SIZE = 65507;

    private static final long JOIN_TIMEOUT_MS = 1000;

    private final InetSocketAddress bindAddress;
    private final DatagramRouter router;
    private final AtomicLong received = new AtomicLong();
    private final AtomicLong routingFailures = new AtomicLong();

    private volatile DatagramChannel channel;
    private volatile InetSocketAddress localAddress;
    private Thread readerThread;

    /**
     * Creates a listener.
     *
     * @param bindAddress where to receive voice datagrams
     * @param router      matches each datagram to its session
     */
    public DatagramListener(InetSocketAddress bindAddress, DatagramRouter router)
    {
        this.bindAddress = Objects.requireNonNull(bindAddress, "bindAddress");
        this.router = Objects.requireNonNull(router, "router");
    }

    /**
     * Binds the voice port and starts reading.
     *
     * @throws UncheckedIOException if the port cannot be bound
     */
    public synchronized void start()
    {
        if (channel != null)
        {
            throw new IllegalStateException("Datagram listener already started");
        }

        DatagramChannel opened;
        try
        {
            opened = DatagramChannel.open();
            opened.bind(bindAddress);
            localAddress = (InetSocketAddress) opened.getLocalAddress();
        }
        catch (IOException e)
        {
            throw new UncheckedIOException("Cannot bind voice port " + bindAddress, e);
        }

        channel = opened;
        readerThread = new Thread(() -> readLoop(opened), "voice-udp-" + localAddress.getPort());
        readerThread.setDaemon(true);
        readerThread.start();

        LOG.info("Voice datagrams on {}", localAddress);
    }

    @Override
    public synchronized void close()
    {
        DatagramChannel open = channel;
        if (open == null || !open.isOpen())
        {
            return;
        }

        try
        {
            open.close();
        }
        catch (IOException e)
        {
            LOG.warn("Voice port {} did not close cleanly: {}", localAddress, e.getMessage());
        }

        try
        {
            readerThread.join(JOIN_TIMEOUT_MS);
        }
        catch (InterruptedException e)
        {
            Thread.currentThread().interrupt();
        }

        LOG.info("Voice port {} closed after {} datagrams", localAddress, received.get());
    }

    /**
     * Returns the bound address.
     *
     * @return the local address, or null before {@link #start()}
     */
    public InetSocketAddress getLocalAddress()
    {
        return localAddress;
    }

    /**
     * Returns the number of datagrams read from the socket.
     */
    public long receivedCount()
    {
        return received.get();
    }

    /**
     * Returns the number of datagrams whose routing threw.
     */
    public long routingFailureCount()
    {
        return routingFailures.get();
    }

    private void readLoop(DatagramChannel source)
    {
        ByteBuffer buffer = ByteBuffer.allocate(MAX_DATAGRAM_SIZE);
        while (source.isOpen())
        {
            InetSocketAddress sender;
            try
            {
                buffer.clear();
                sender = (InetSocketAddress) source.receive(buffer);
            }
            catch (ClosedChannelException e)
            {
                break;
            }
            catch (IOException e)
            {
                LOG.warn("Receive failed on {}: {}", localAddress, e.getMessage());
                continue;
            }

            buffer.flip();
            received.incrementAndGet();
            try
            {
                router.route(buffer, sender);
            }
            catch (RuntimeException e)
            {
                routingFailures.incrementAndGet();
                LOG.error("Routing failed for datagram from {}", sender, e);
            }
        }

        LOG.debug("Voice reader for {} stopped", localAddress);
    }
}
