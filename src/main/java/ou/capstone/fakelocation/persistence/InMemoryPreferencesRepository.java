package ou.capstone.fakelocation.persistence;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

import ou.capstone.fakelocation.model.Coordinate;
import ou.capstone.fakelocation.model.FavoriteLocation;

/**
 * Process-local preferences; everything is lost when the JVM exits.
 */
public class InMemoryPreferencesRepository implements PreferencesRepository {

    private boolean playing;
    private Coordinate lastClickedLocation;
    private final List<FavoriteLocation> favorites = new ArrayList<>();

    @Override
    public void saveIsPlaying(final boolean playing) {
        this.playing = playing;
    }

    @Override
    public void saveLastClickedLocation(final float latitude, final float longitude) {
        this.lastClickedLocation = new Coordinate(latitude, longitude);
    }

    @Override
    public void clearLastClickedLocation() {
        this.lastClickedLocation = null;
    }

    @Override
    public void addFavorite(final FavoriteLocation favorite) {
        favorites.add(Objects.requireNonNull(favorite, "favorite"));
    }

    @Override
    public boolean isPlaying() {
        return playing;
    }

    @Override
    public Optional<Coordinate> getLastClickedLocation() {
        return Optional.ofNullable(lastClickedLocation);
    }

    @Override
    public List<FavoriteLocation> getFavorites() {
        return List.copyOf(favorites);
    }
}
