package ou.capstone.fakelocation.model;

/**
 * A named location the user saved from the "add to favorites" dialog.
 */
public record FavoriteLocation(String name, double latitude, double longitude) {

    public Coordinate toCoordinate() {
        return new Coordinate(latitude, longitude);
    }

    @Override
    public String toString() {
        return name + " " + toCoordinate();
    }
}
