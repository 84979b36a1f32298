package ou.capstone.fakelocation;

import java.nio.file.Path;
import java.time.Duration;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Settings for one console session.
 * Defaults come from the environment and can be overridden from the command line.
 */
public final class SessionConfig {
    private static final Logger logger = LoggerFactory.getLogger(SessionConfig.class);

    static final String PREFS_FILE_ENV = "FAKELOC_PREFS_FILE";
    static final String EVENT_TIMEOUT_ENV = "FAKELOC_EVENT_TIMEOUT_MS";

    private static final String DEFAULT_PREFS_FILE = "fake-location-prefs.json";
    private static final long DEFAULT_EVENT_TIMEOUT_MS = 2000;

    private final Path preferencesFile;
    private final Duration eventTimeout;

    public SessionConfig(final Path preferencesFile, final Duration eventTimeout) {
        this.preferencesFile = preferencesFile;
        this.eventTimeout = eventTimeout;
    }

    /** Reads defaults from the process environment. */
    public static SessionConfig fromEnvironment() {
        return fromEnvironment(System.getenv());
    }

    static SessionConfig fromEnvironment(final Map<String, String> env) {
        final Path prefs = Path.of(env.getOrDefault(PREFS_FILE_ENV, DEFAULT_PREFS_FILE));

        long timeoutMs = DEFAULT_EVENT_TIMEOUT_MS;
        final String rawTimeout = env.get(EVENT_TIMEOUT_ENV);
        if (rawTimeout != null) {
            try {
                timeoutMs = Long.parseLong(rawTimeout.trim());
                if (timeoutMs <= 0) {
                    logger.warn("{} must be positive, using {} ms", EVENT_TIMEOUT_ENV, DEFAULT_EVENT_TIMEOUT_MS);
                    timeoutMs = DEFAULT_EVENT_TIMEOUT_MS;
                }
            } catch (NumberFormatException e) {
                logger.warn("Invalid {} '{}', using {} ms", EVENT_TIMEOUT_ENV, rawTimeout, DEFAULT_EVENT_TIMEOUT_MS);
            }
        }
        return new SessionConfig(prefs, Duration.ofMillis(timeoutMs));
    }

    public SessionConfig withPreferencesFile(final Path file) {
        return new SessionConfig(file, eventTimeout);
    }

    public Path getPreferencesFile() {
        return preferencesFile;
    }

    /** How long the console waits for the map to receive an event. */
    public Duration getEventTimeout() {
        return eventTimeout;
    }

    @Override
    public String toString() {
        return String.format("SessionConfig{preferencesFile=%s, eventTimeout=%dms}",
                preferencesFile, eventTimeout.toMillis());
    }
}
