package ou.capstone.fakelocation.persistence;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import ou.capstone.fakelocation.exceptions.PreferencesException;
import ou.capstone.fakelocation.model.Coordinate;
import ou.capstone.fakelocation.model.FavoriteLocation;

/**
 * Keeps preferences in a single JSON file, rewritten on every change.
 * <p>
 * A missing file means defaults (not playing, no clicked location, no favorites).
 */
public class JsonPreferencesRepository implements PreferencesRepository {

    private static final Logger logger = LoggerFactory.getLogger(JsonPreferencesRepository.class);

    private final ObjectMapper mapper = new ObjectMapper()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    private final Path file;
    private final PreferencesDocument document;

    /**
     * Loads the preferences file.
     *
     * @param file location of the JSON document; need not exist yet
     * @throws PreferencesException if the file exists but cannot be read or parsed
     */
    public JsonPreferencesRepository(final Path file) throws PreferencesException {
        this.file = Objects.requireNonNull(file, "file");
        this.document = load(file);
    }

    private PreferencesDocument load(final Path path) throws PreferencesException {
        if (!Files.exists(path)) {
            logger.info("No preferences file at {}, starting with defaults", path);
            return new PreferencesDocument();
        }
        try {
            final PreferencesDocument loaded = mapper.readValue(path.toFile(), PreferencesDocument.class);
            if (loaded.favorites == null) {
                loaded.favorites = new ArrayList<>();
            } else if (loaded.favorites.removeIf(Objects::isNull)) {
                logger.warn("Skipped empty favorite entries in {}", path);
            }
            logger.info("Loaded preferences from {} ({} favorite(s))", path, loaded.favorites.size());
            return loaded;
        } catch (JsonProcessingException e) {
            throw new PreferencesException("Malformed preferences file: " + path, e);
        } catch (IOException e) {
            throw new PreferencesException("Could not read preferences file: " + path, e);
        }
    }

    @Override
    public void saveIsPlaying(final boolean playing) {
        document.playing = playing;
        write();
    }

    @Override
    public void saveLastClickedLocation(final float latitude, final float longitude) {
        document.lastClickedLatitude = latitude;
        document.lastClickedLongitude = longitude;
        write();
    }

    @Override
    public void clearLastClickedLocation() {
        document.lastClickedLatitude = null;
        document.lastClickedLongitude = null;
        write();
    }

    @Override
    public void addFavorite(final FavoriteLocation favorite) {
        document.favorites.add(Objects.requireNonNull(favorite, "favorite"));
        write();
    }

    @Override
    public boolean isPlaying() {
        return document.playing;
    }

    @Override
    public Optional<Coordinate> getLastClickedLocation() {
        if (document.lastClickedLatitude == null || document.lastClickedLongitude == null) {
            return Optional.empty();
        }
        return Optional.of(new Coordinate(document.lastClickedLatitude, document.lastClickedLongitude));
    }

    @Override
    public List<FavoriteLocation> getFavorites() {
        return List.copyOf(document.favorites);
    }

    private void write() {
        try {
            final Path parent = file.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            mapper.writerWithDefaultPrettyPrinter().writeValue(file.toFile(), document);
            logger.debug("Preferences written to {}", file);
        } catch (IOException e) {
            logger.error("Failed to write preferences to {}: {}", file, e.getMessage());
            throw new UncheckedIOException("Could not write preferences file: " + file, e);
        }
    }

    /** On-disk shape of the preferences file. */
    static final class PreferencesDocument {
        public boolean playing;
        public Float lastClickedLatitude;
        public Float lastClickedLongitude;
        public List<FavoriteLocation> favorites = new ArrayList<>();

        public PreferencesDocument() {
        }
    }
}
