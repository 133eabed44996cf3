package net.spookly.hyping;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.file.Paths;

import org.junit.jupiter.api.Test;

class HypingMainTest {
    @Test
    void defaultsToServerMode() {
        HypingMain.CliOptions options = HypingMain.parseArgs(new String[0]);

        assertEquals(Paths.get("config/hyping.yaml"), options.configPath());
        assertNull(options.queryTarget());
        assertFalse(options.dryRun());
        assertEquals(1000, options.timeoutMs());
        assertEquals(1, options.count());
    }

    @Test
    void parsesQueryMode() {
        HypingMain.CliOptions options = HypingMain.parseArgs(
                new String[] {"-q", "127.0.0.1:14006", "--timeout", "250", "--count", "3"}
        );

        assertEquals("127.0.0.1:14006", options.queryTarget());
        assertEquals(250, options.timeoutMs());
        assertEquals(3, options.count());
    }

    @Test
    void parsesServerFlags() {
        HypingMain.CliOptions options = HypingMain.parseArgs(
                new String[] {"--config", "other.yaml", "--dry-run", "--print-effective-config"}
        );

        assertEquals(Paths.get("other.yaml"), options.configPath());
        assertTrue(options.dryRun());
        assertTrue(options.printEffectiveConfig());
    }

    @Test
    void rejectsBadArguments() {
        assertThrows(IllegalArgumentException.class, () -> HypingMain.parseArgs(new String[] {"--bogus"}));
        assertThrows(IllegalArgumentException.class, () -> HypingMain.parseArgs(new String[] {"--config"}));
        assertThrows(IllegalArgumentException.class, () -> HypingMain.parseArgs(new String[] {"--timeout", "0"}));
        assertThrows(IllegalArgumentException.class, () -> HypingMain.parseArgs(new String[] {"--count", "x"}));
    }
}
