package ou.capstone.fakelocation.validation;

import ou.capstone.fakelocation.model.Coordinate;

/**
 * Validation rules for dialog inputs.
 * <p>
 * Every rule returns the error text to show under the field, or {@code null} when the
 * input is acceptable. Nothing here throws on bad input.
 */
public final class InputValidator {

    public static final String LATITUDE_ERROR = "Latitude must be between -90 and 90";
    public static final String LONGITUDE_ERROR = "Longitude must be between -180 and 180";
    public static final String NAME_ERROR = "Please provide a name";

    private InputValidator() {
        // Prevent instantiation
    }

    /**
     * Checks that {@code input} parses as a number inside {@code [low, high]}.
     *
     * @param input     raw field text (may be null)
     * @param low       inclusive lower bound
     * @param high      inclusive upper bound
     * @param errorText message returned on failure
     * @return {@code errorText} if the input is not a number or out of range, else null
     */
    public static String validate(final String input, final double low, final double high,
                                  final String errorText) {
        final Double value = parseOrNull(input);
        if (value == null || !(value >= low && value <= high)) {
            return errorText;
        }
        return null;
    }

    public static String validateLatitude(final String input) {
        return validate(input, Coordinate.MIN_LATITUDE, Coordinate.MAX_LATITUDE, LATITUDE_ERROR);
    }

    public static String validateLongitude(final String input) {
        return validate(input, Coordinate.MIN_LONGITUDE, Coordinate.MAX_LONGITUDE, LONGITUDE_ERROR);
    }

    /**
     * @return {@link #NAME_ERROR} for a null, empty or whitespace-only name
     */
    public static String validateName(final String name) {
        return (name == null || name.isBlank()) ? NAME_ERROR : null;
    }

    /**
     * Parses a field value that already passed {@link #validate}.
     *
     * @throws NumberFormatException if the value was never validated
     */
    public static double parseValidated(final String input) {
        return Double.parseDouble(input);
    }

    private static Double parseOrNull(final String s) {
        if (s == null || s.isBlank()) return null;
        try {
            return Double.parseDouble(s);
        } catch (NumberFormatException e) {
            return null;
        }
    }
}
