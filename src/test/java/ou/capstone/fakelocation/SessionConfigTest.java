package ou.capstone.fakelocation;

import static org.junit.jupiter.api.Assertions.assertEquals;

import java.nio.file.Path;
import java.time.Duration;
import java.util.Map;

import org.junit.jupiter.api.Test;

class SessionConfigTest {

    @Test
    void defaultsWhenEnvironmentIsEmpty() {
        SessionConfig config = SessionConfig.fromEnvironment(Map.of());

        assertEquals(Path.of("fake-location-prefs.json"), config.getPreferencesFile());
        assertEquals(Duration.ofMillis(2000), config.getEventTimeout());
    }

    @Test
    void readsEnvironmentOverrides() {
        SessionConfig config = SessionConfig.fromEnvironment(Map.of(
                SessionConfig.PREFS_FILE_ENV, "/tmp/prefs.json",
                SessionConfig.EVENT_TIMEOUT_ENV, "250"));

        assertEquals(Path.of("/tmp/prefs.json"), config.getPreferencesFile());
        assertEquals(Duration.ofMillis(250), config.getEventTimeout());
    }

    @Test
    void invalidTimeoutFallsBackToDefault() {
        assertEquals(Duration.ofMillis(2000),
                SessionConfig.fromEnvironment(Map.of(SessionConfig.EVENT_TIMEOUT_ENV, "soon")).getEventTimeout());
        assertEquals(Duration.ofMillis(2000),
                SessionConfig.fromEnvironment(Map.of(SessionConfig.EVENT_TIMEOUT_ENV, "-5")).getEventTimeout());
    }

    @Test
    void commandLineFileOverridesEnvironment() {
        SessionConfig config = SessionConfig.fromEnvironment(Map.of(SessionConfig.PREFS_FILE_ENV, "a.json"))
                .withPreferencesFile(Path.of("b.json"));

        assertEquals(Path.of("b.json"), config.getPreferencesFile());
    }
}
