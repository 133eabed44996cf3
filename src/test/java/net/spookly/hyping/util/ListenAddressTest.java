package net.spookly.hyping.util;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.Test;

class ListenAddressTest {
    @Test
    void parsesHostAndPort() {
        ListenAddress address = ListenAddress.parse("127.0.0.1:14006");
        assertEquals("127.0.0.1", address.host());
        assertEquals(14006, address.port());
        assertEquals("127.0.0.1:14006", address.toString());
    }

    @Test
    void parsesBracketedIpv6() {
        ListenAddress address = ListenAddress.parse("[::1]:14006");
        assertEquals("::1", address.host());
        assertEquals("[::1]:14006", address.toString());
    }

    @Test
    void rejectsInvalidFormat() {
        assertThrows(IllegalArgumentException.class, () -> ListenAddress.parse("bad"));
        assertThrows(IllegalArgumentException.class, () -> ListenAddress.parse("::1:14006"));
        assertThrows(IllegalArgumentException.class, () -> ListenAddress.parse("host:0"));
        assertThrows(IllegalArgumentException.class, () -> ListenAddress.parse("host:70000"));
        assertThrows(IllegalArgumentException.class, () -> ListenAddress.parse("host:port"));
    }
}
