package ou.capstone.fakelocation.persistence;

import java.util.List;
import java.util.Optional;

import ou.capstone.fakelocation.model.Coordinate;
import ou.capstone.fakelocation.model.FavoriteLocation;

/**
 * Durable storage for the simulation flag, the last clicked location and the favorites list.
 * <p>
 * Calls are synchronous and made from the UI thread.
 */
public interface PreferencesRepository {

    void saveIsPlaying(boolean playing);

    /** Locations are stored with float precision. */
    void saveLastClickedLocation(float latitude, float longitude);

    void clearLastClickedLocation();

    /** Appends to the favorites list. */
    void addFavorite(FavoriteLocation favorite);

    boolean isPlaying();

    Optional<Coordinate> getLastClickedLocation();

    /** @return favorites in insertion order */
    List<FavoriteLocation> getFavorites();
}
