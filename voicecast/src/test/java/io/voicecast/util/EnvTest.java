package io.voicecast.util;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class EnvTest {

    private static final String KEY = "VOICECAST_ENV_TEST_KEY";

    @AfterEach
    void tearDown() {
        System.clearProperty(KEY);
    }

    @Test
    void fallsBackToSystemPropertyThenDefault() {
        assertEquals("dflt", Env.get(KEY, "dflt"));

        System.setProperty(KEY, "from-property");
        assertEquals("from-property", Env.get(KEY, "dflt"));
    }

    @Test
    void numbersFallBackOnGarbage() {
        System.setProperty(KEY, " 42 ");
        assertEquals(42, Env.getInt(KEY, 7));
        assertEquals(42L, Env.getLong(KEY, 7L));

        System.setProperty(KEY, "forty-two");
        assertEquals(7, Env.getInt(KEY, 7));
    }

    @Test
    void millisAsDuration() {
        assertEquals(Duration.ofSeconds(2), Env.getMillis(KEY, Duration.ofSeconds(2)));

        System.setProperty(KEY, "1500");
        assertEquals(Duration.ofMillis(1500), Env.getMillis(KEY, Duration.ofSeconds(2)));
    }

    @Test
    void booleans() {
        System.setProperty(KEY, "TRUE");
        assertTrue(Env.getBool(KEY, false));
        System.setProperty(KEY, "no");
        assertFalse(Env.getBool(KEY, true));
    }

    @Test
    void pairsSkipMalformedEntries() {
        System.setProperty(KEY, "fr=fr-CA, en = en-GB,broken,=x,y=");

        Map<String, String> pairs = Env.getPairs(KEY);

        assertEquals(Map.of("fr", "fr-CA", "en", "en-GB"), pairs);
        assertThrows(UnsupportedOperationException.class, () -> pairs.put("de", "de-AT"));
    }
}
