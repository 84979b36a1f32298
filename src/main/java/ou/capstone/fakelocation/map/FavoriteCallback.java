package ou.capstone.fakelocation.map;

/** Receives the trimmed name and parsed coordinates of a valid "add to favorites" submission. */
@FunctionalInterface
public interface FavoriteCallback {

    void accept(String name, double latitude, double longitude);
}
