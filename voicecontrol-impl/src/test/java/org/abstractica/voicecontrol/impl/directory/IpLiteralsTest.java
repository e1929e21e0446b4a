package org.abstractica.voicecontrol.impl.directory;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for {@link IpLiterals}.
 */
class IpLiteralsTest
{
    @Test
    void isValid_ipv4()
    {
        assertTrue(IpLiterals.isValid("10.0.0.1"));
        assertTrue(IpLiterals.isValid("0.0.0.0"));
        assertTrue(IpLiterals.isValid("255.255.255.255"));
    }

    @Test
    void isValid_ipv6()
    {
        assertTrue(IpLiterals.isValid("::1"));
        assertTrue(IpLiterals.isValid("::"));
        assertTrue(IpLiterals.isValid("2001:db8::8a2e:370:7334"));
        assertTrue(IpLiterals.isValid("::ffff:192.168.1.1"));
    }

    @Test
    void isValid_rejectsNonLiterals()
    {
        assertFalse(IpLiterals.isValid(null));
        assertFalse(IpLiterals.isValid(""));
        assertFalse(IpLiterals.isValid("not-an-ip"));
        assertFalse(IpLiterals.isValid("localhost"));
        assertFalse(IpLiterals.isValid("example.com"));
        assertFalse(IpLiterals.isValid("256.0.0.1"));
        assertFalse(IpLiterals.isValid("1.2.3"));
        assertFalse(IpLiterals.isValid("1.2.3.4.5"));
        assertFalse(IpLiterals.isValid("01.2.3.4"));
        assertFalse(IpLiterals.isValid(" 1.2.3.4"));
        assertFalse(IpLiterals.isValid("1:2:3:4:5:6:7:8:9"));
        assertFalse(IpLiterals.isValid("2001:db8::g"));
        assertFalse(IpLiterals.isValid("[::1]"));
        assertFalse(IpLiterals.isValid(":::"));
    }

    @Test
    void normalize_ipv6SpellingsAgree()
    {
        assertEquals(IpLiterals.normalize("::1"), IpLiterals.normalize("0:0:0:0:0:0:0:1"));
        assertEquals(IpLiterals.normalize("2001:DB8::1"), IpLiterals.normalize("2001:db8:0:0:0:0:0:1"));
    }

    @Test
    void normalize_ipv4Unchanged()
    {
        assertEquals("192.168.1.100", IpLiterals.normalize("192.168.1.100").orElseThrow());
    }
}
