package org.abstractica.voicecontrol.demo.server;

import org.abstractica.voicecontrol.VoiceServer;
import org.abstractica.voicecontrol.impl.server.DefaultVoiceServerFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;

/**
 * Demo server: control connections on one port, datagrams on the next.
 *
 * <p>Usage: {@code DemoServer [controlPort] [datagramPort]}. Type
 * {@code quit} to stop.</p>
 */
public class DemoServer
{
    private static final Logger LOG = LoggerFactory.getLogger(DemoServer.class);
    private static final int DEFAULT_CONTROL_PORT = 7000;

    public static void main(String[] args) throws IOException
    {
        int controlPort = args.length > 0 ? Integer.parseInt(args[0]) : DEFAULT_CONTROL_PORT;
        int datagramPort = args.length > 1 ? Integer.parseInt(args[1]) : controlPort + 1;

        VoiceServer server = new DefaultVoiceServerFactory().builder()
                .controlPort(controlPort)
                .datagramPort(datagramPort)
                .gateway(new ChannelGateway())
                .datagramHandler((session, data) ->
                        LOG.trace("Datagram from session {}: {} bytes", session.getNumericId(), data.remaining()))
                .errorHandler((session, message, exception) ->
                        LOG.error("Gateway failed: session={}, message={}", session, message, exception))
                .build();

        server.start();
        Runtime.getRuntime().addShutdownHook(new Thread(server::close, "shutdown"));

        System.out.println("Voice server running. Type 'quit' to stop.");
        BufferedReader reader = new BufferedReader(new InputStreamReader(System.in));
        String line;
        while ((line = reader.readLine()) != null)
        {
            if (line.trim().equalsIgnoreCase("quit"))
            {
                break;
            }
            if (line.trim().equalsIgnoreCase("sessions"))
            {
                server.getDirectory().getAllSessions().forEach(s -> System.out.println("  " + s));
            }
        }

        server.close();
    }
}
