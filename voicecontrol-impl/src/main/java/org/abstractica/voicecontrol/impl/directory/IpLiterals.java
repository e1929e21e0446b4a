package org.abstractica.voicecontrol.impl.directory;

import java.net.InetAddress;
import java.net.UnknownHostException;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Syntactic validation and normalization of IP address literals.
 *
 * <p>Never performs a name lookup: anything that is not an IPv4 dotted quad or
 * an IPv6 literal is rejected before {@link InetAddress} sees it.</p>
 */
final class IpLiterals
{
    private static final Pattern IPV4 = Pattern.compile(
            "(25[0-5]|2[0-4]\\d|1\\d\\d|[1-9]?\\d)(\\.(25[0-5]|2[0-4]\\d|1\\d\\d|[1-9]?\\d)){3}");

    // Hex groups, colons and an optional embedded IPv4 tail, then an optional zone.
    private static final Pattern IPV6_SHAPE = Pattern.compile(
            "[0-9A-Fa-f:][0-9A-Fa-f:.]*(%[0-9A-Za-z_.\\-]+)?");

    private IpLiterals() {}

    /**
     * Checks whether a string is an IPv4 or IPv6 address literal.
     *
     * @param literal the string to check, may be null
     * @return true if it is a literal
     */
    static boolean isValid(String literal)
    {
        return parse(literal).isPresent();
    }

    /**
     * Returns the canonical text form of an address literal.
     *
     * @param literal the address literal, may be null
     * @return canonical form, or empty if not a literal
     */
    static Optional<String> normalize(String literal)
    {
        return parse(literal).map(InetAddress::getHostAddress);
    }

    private static Optional<InetAddress> parse(String literal)
    {
        if (literal == null || literal.isEmpty())
        {
            return Optional.empty();
        }

        boolean v4 = IPV4.matcher(literal).matches();
        boolean v6 = !v4 && literal.indexOf(':') >= 0 && IPV6_SHAPE.matcher(literal).matches();
        if (!v4 && !v6)
        {
            return Optional.empty();
        }

        try
        {
            return Optional.of(InetAddress.getByName(literal));
        }
        catch (UnknownHostException e)
        {
            return Optional.empty();
        }
    }
}
