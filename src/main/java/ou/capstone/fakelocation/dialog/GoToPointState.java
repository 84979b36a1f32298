package ou.capstone.fakelocation.dialog;

/**
 * Field state of the "go to point" dialog.
 */
public record GoToPointState(InputField latitude, InputField longitude) {

    public static final GoToPointState EMPTY = new GoToPointState(InputField.EMPTY, InputField.EMPTY);

    public GoToPointState {
        latitude = (latitude == null) ? InputField.EMPTY : latitude;
        longitude = (longitude == null) ? InputField.EMPTY : longitude;
    }

    public InputField field(final GoToPointField field) {
        return switch (field) {
            case LATITUDE -> latitude;
            case LONGITUDE -> longitude;
        };
    }

    /**
     * Replaces the value of one field, keeping its error message.
     */
    public GoToPointState withValue(final GoToPointField field, final String value) {
        return switch (field) {
            case LATITUDE -> new GoToPointState(latitude.withValue(value), longitude);
            case LONGITUDE -> new GoToPointState(latitude, longitude.withValue(value));
        };
    }

    public GoToPointState withErrors(final String latitudeError, final String longitudeError) {
        return new GoToPointState(latitude.withErrorMessage(latitudeError),
                longitude.withErrorMessage(longitudeError));
    }
}
