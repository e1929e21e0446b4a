package org.abstractica.voicecontrol.impl.transport;

import org.abstractica.voicecontrol.impl.control.ControlConnection;
import org.abstractica.voicecontrol.impl.control.ControlConnectionFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.net.InetSocketAddress;
import java.net.ServerSocket;
import java.net.Socket;
import java.net.SocketException;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * TCP acceptor for control connections.
 *
 * <p>One thread accepts connections; each accepted connection is read by its
 * own worker thread, which is the only thread feeding that connection's
 * framer.</p>
 */
public class ControlListener implements AutoCloseable
{
    private static final Logger LOG = LoggerFactory.getLogger(ControlListener.class);
    private static final int READ_BUFFER_SIZE = 8192;

    private final InetSocketAddress bindAddress;
    private final ControlConnectionFactory connectionFactory;
    private final Map<String, ControlConnection> connections = new ConcurrentHashMap<>();
    private final AtomicBoolean running = new AtomicBoolean(false);
    private final AtomicInteger workerCount = new AtomicInteger();

    private ServerSocket serverSocket;
    private ExecutorService workers;
    private Thread acceptThread;

    /**
     * Creates a listener.
     *
     * @param bindAddress       the address and port to listen on
     * @param connectionFactory creates the per-connection state
     */
    public ControlListener(InetSocketAddress bindAddress, ControlConnectionFactory connectionFactory)
    {
        this.bindAddress = Objects.requireNonNull(bindAddress, "bindAddress");
        this.connectionFactory = Objects.requireNonNull(connectionFactory, "connectionFactory");
    }

    /**
     * Binds the server socket and starts accepting.
     *
     * @throws UncheckedIOException if the socket cannot be bound
     */
    public void start()
    {
        if (!running.compareAndSet(false, true))
        {
            throw new IllegalStateException("Listener already started");
        }

        try
        {
            serverSocket = new ServerSocket();
            serverSocket.setReuseAddress(true);
            serverSocket.bind(bindAddress);
        }
        catch (IOException e)
        {
            running.set(false);
            throw new UncheckedIOException("Failed to bind control listener to " + bindAddress, e);
        }

        workers = Executors.newCachedThreadPool(task ->
        {
            Thread thread = new Thread(task, "control-conn-" + workerCount.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });

        acceptThread = new Thread(this::acceptLoop, "control-accept-" + serverSocket.getLocalPort());
        acceptThread.setDaemon(true);
        acceptThread.start();

        LOG.info("Control listener started on {}", serverSocket.getLocalSocketAddress());
    }

    @Override
    public void close()
    {
        if (!running.compareAndSet(true, false))
        {
            return;
        }

        LOG.info("Closing control listener");

        try
        {
            serverSocket.close();
        }
        catch (IOException e)
        {
            LOG.warn("Error closing server socket", e);
        }

        for (ControlConnection connection : connections.values())
        {
            connection.close("server shutdown");
        }

        workers.shutdown();
        try
        {
            if (!workers.awaitTermination(1, TimeUnit.SECONDS))
            {
                workers.shutdownNow();
            }
        }
        catch (InterruptedException e)
        {
            workers.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    /**
     * Returns the bound address.
     *
     * @return the local address, or null if not started
     */
    public InetSocketAddress getLocalAddress()
    {
        return serverSocket == null ? null : (InetSocketAddress) serverSocket.getLocalSocketAddress();
    }

    /**
     * Returns the number of open control connections.
     */
    public int getConnectionCount()
    {
        return connections.size();
    }

    private void acceptLoop()
    {
        while (running.get())
        {
            try
            {
                handOff(serverSocket.accept());
            }
            catch (SocketException e)
            {
                if (running.get())
                {
                    LOG.error("Accept failed", e);
                }
            }
            catch (IOException e)
            {
                LOG.error("Accept failed", e);
            }
        }

        LOG.debug("Accept loop exited");
    }

    /**
     * Passes an accepted socket to a worker, or closes it if none will take it.
     *
     * @param socket the accepted socket
     */
    void handOff(Socket socket)
    {
        try
        {
            socket.setTcpNoDelay(true);
            workers.execute(() -> serve(socket));
        }
        catch (SocketException | RejectedExecutionException e)
        {
            LOG.debug("Dropping accepted socket {}: {}", socket.getRemoteSocketAddress(), e.toString());
            closeSocket(socket);
        }
    }

    private void serve(Socket socket)
    {
        ControlConnection connection;
        try
        {
            connection = connectionFactory.create(new SocketControlTransport(socket));
        }
        catch (IOException e)
        {
            LOG.warn("Could not set up connection from {}: {}", socket.getRemoteSocketAddress(), e.getMessage());
            closeSocket(socket);
            return;
        }

        connections.put(connection.getConnectionId(), connection);
        LOG.debug("Accepted {} as {}", socket.getRemoteSocketAddress(), connection.getConnectionId());

        byte[] buffer = new byte[READ_BUFFER_SIZE];
        try (InputStream in = socket.getInputStream())
        {
            int read;
            while (connection.isOpen() && (read = in.read(buffer)) != -1)
            {
                connection.onData(buffer, 0, read);
            }
        }
        catch (IOException e)
        {
            if (connection.isOpen())
            {
                LOG.debug("Read failed on {}: {}", connection.getConnectionId(), e.getMessage());
            }
        }
        finally
        {
            connection.onClosed();
            connections.remove(connection.getConnectionId());
        }
    }

    private static void closeSocket(Socket socket)
    {
        try
        {
            socket.close();
        }
        catch (IOException e)
        {
            LOG.debug("Error closing socket: {}", e.getMessage());
        }
    }
}
