package in.sitewatch.util;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class EnvTest {

    @AfterEach
    void clearProperties() {
        System.clearProperty("SITEWATCH_TEST_HOST");
        System.clearProperty("SITEWATCH_TEST_PORT");
    }

    @Test
    void fallsBackToDefault() {
        assertEquals("fallback", Env.get("SITEWATCH_TEST_UNSET", "fallback"));
        assertEquals(7, Env.getInt("SITEWATCH_TEST_UNSET", 7));
        assertTrue(Env.getBool("SITEWATCH_TEST_UNSET", true));
    }

    @Test
    void readsSystemProperties() {
        System.setProperty("SITEWATCH_TEST_PORT", "9191");

        assertEquals(9191, Env.getInt("SITEWATCH_TEST_PORT", 1));
    }

    @Test
    void invalidIntegerUsesDefault() {
        System.setProperty("SITEWATCH_TEST_PORT", "ninety");

        assertEquals(1, Env.getInt("SITEWATCH_TEST_PORT", 1));
    }

    @Test
    void resolvesPlaceholders() {
        System.setProperty("SITEWATCH_TEST_HOST", "hooks.example.com");
        System.setProperty("SITEWATCH_TEST_PORT", "8443");

        assertEquals("https://hooks.example.com:8443/x",
            Env.resolvePlaceholders("https://${SITEWATCH_TEST_HOST}:${SITEWATCH_TEST_PORT}/x"));
        assertEquals("plain", Env.resolvePlaceholders("plain"));
        assertNull(Env.resolvePlaceholders(null));
    }

    @Test
    void unsetPlaceholderResolvesToNull() {
        System.setProperty("SITEWATCH_TEST_HOST", "hooks.example.com");

        assertNull(Env.resolvePlaceholders("https://${SITEWATCH_TEST_HOST}/${SITEWATCH_TEST_UNSET}"));
    }
}
