package ou.capstone.fakelocation.dialog;

/**
 * Field state of the "add to favorites" dialog.
 */
public record FavoritesInputState(InputField name, InputField latitude, InputField longitude) {

    public static final FavoritesInputState EMPTY =
            new FavoritesInputState(InputField.EMPTY, InputField.EMPTY, InputField.EMPTY);

    public FavoritesInputState {
        name = (name == null) ? InputField.EMPTY : name;
        latitude = (latitude == null) ? InputField.EMPTY : latitude;
        longitude = (longitude == null) ? InputField.EMPTY : longitude;
    }

    public InputField field(final FavoritesField field) {
        return switch (field) {
            case NAME -> name;
            case LATITUDE -> latitude;
            case LONGITUDE -> longitude;
        };
    }

    /**
     * Replaces the value of one field, keeping its error message.
     */
    public FavoritesInputState withValue(final FavoritesField field, final String value) {
        return switch (field) {
            case NAME -> new FavoritesInputState(name.withValue(value), latitude, longitude);
            case LATITUDE -> new FavoritesInputState(name, latitude.withValue(value), longitude);
            case LONGITUDE -> new FavoritesInputState(name, latitude, longitude.withValue(value));
        };
    }

    /**
     * Replaces the latitude and longitude values only; name and all errors stay.
     */
    public FavoritesInputState withCoordinateValues(final String latitudeValue, final String longitudeValue) {
        return new FavoritesInputState(name, latitude.withValue(latitudeValue), longitude.withValue(longitudeValue));
    }

    public FavoritesInputState withErrors(final String nameError,
                                          final String latitudeError,
                                          final String longitudeError) {
        return new FavoritesInputState(name.withErrorMessage(nameError),
                latitude.withErrorMessage(latitudeError),
                longitude.withErrorMessage(longitudeError));
    }
}
