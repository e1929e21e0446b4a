package org.abstractica.voicecontrol;

import java.util.Objects;

/**
 * A UDP source endpoint: an IP address literal and a port.
 *
 * <p>Used both as session state and as a directory lookup key. Directories
 * normalize the address before building a key, so two spellings of the same
 * IPv6 address refer to the same endpoint.</p>
 *
 * @param address IPv4 or IPv6 address literal
 * @param port    port in [1, 65535]
 */
public record UdpEndpoint(String address, int port)
{
    public UdpEndpoint
    {
        Objects.requireNonNull(address, "address");
        if (port < 1 || port > 65535)
        {
            throw new IllegalArgumentException("Port must be 1-65535: " + port);
        }
    }

    @Override
    public String toString()
    {
        return address.indexOf(':') >= 0
                ? "[" + address + "]:" + port
                : address + ":" + port;
    }
}
