package org.abstractica.voicecontrol.impl.directory;

import org.abstractica.voicecontrol.Session;
import org.abstractica.voicecontrol.UdpEndpoint;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Exercises {@link DefaultSessionDirectory} from several threads at once and
 * checks that the three indices agree afterwards.
 */
class ConcurrentDirectoryTest
{
    private static final int THREADS = 8;
    private static final int OPERATIONS = 2000;

    @Test
    void mixedOperations_indicesStayConsistent() throws Exception
    {
        DefaultSessionDirectory directory = new DefaultSessionDirectory(Clock.systemUTC());
        ExecutorService executor = Executors.newFixedThreadPool(THREADS);
        CountDownLatch start = new CountDownLatch(1);

        try
        {
            List<Future<?>> futures = new ArrayList<>();
            for (int t = 0; t < THREADS; t++)
            {
                int thread = t;
                futures.add(executor.submit(() ->
                {
                    start.await();
                    ThreadLocalRandom random = ThreadLocalRandom.current();
                    for (int i = 0; i < OPERATIONS; i++)
                    {
                        Session session = directory.createSession("t" + thread + "-" + i);
                        int id = session.getNumericId();

                        // Shared endpoint pool forces evictions between threads.
                        String address = "10.0.0." + random.nextInt(1, 20);
                        directory.updateUdpEndpoint(id, address, 5000 + random.nextInt(3));

                        int victim = random.nextInt(1, 200);
                        directory.removeSession(victim);
                        directory.lookupByNumericId(victim);

                        if (random.nextBoolean())
                        {
                            directory.removeSession(id);
                        }
                    }
                    return null;
                }));
            }

            start.countDown();
            for (Future<?> future : futures)
            {
                future.get(30, TimeUnit.SECONDS);
            }
        }
        finally
        {
            executor.shutdownNow();
        }

        assertConsistent(directory);
    }

    private static void assertConsistent(DefaultSessionDirectory directory)
    {
        Set<Integer> ids = new HashSet<>();
        Set<String> connections = new HashSet<>();
        Set<UdpEndpoint> endpoints = new HashSet<>();

        for (Session session : directory.getAllSessions())
        {
            assertTrue(ids.add(session.getNumericId()), "duplicate numeric ID");
            assertTrue(connections.add(session.getConnectionId()), "duplicate connection ID");

            assertSame(session, directory.lookupByNumericId(session.getNumericId()).orElseThrow());
            assertSame(session, directory.lookupByConnectionId(session.getConnectionId()).orElseThrow());

            session.getUdpEndpoint().ifPresent(endpoint ->
            {
                assertTrue(endpoints.add(endpoint), "endpoint owned twice: " + endpoint);
                assertSame(session, directory.lookupByUdpEndpoint(endpoint.address(), endpoint.port()).orElseThrow());
            });
        }

        assertEquals(ids.size(), directory.size());
        assertEquals(endpoints.size(), directory.udpEndpointCount());
    }
}
