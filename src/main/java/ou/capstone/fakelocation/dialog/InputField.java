package ou.capstone.fakelocation.dialog;

/**
 * One user-editable dialog input together with its latest validation error.
 * <p>
 * A null {@code errorMessage} means the field is valid or has not been validated yet;
 * the two cases are not distinguished.
 */
public record InputField(String value, String errorMessage) {

    public static final InputField EMPTY = new InputField("", null);

    public InputField {
        value = (value == null) ? "" : value;
    }

    public InputField withValue(final String newValue) {
        return new InputField(newValue, errorMessage);
    }

    public InputField withErrorMessage(final String newErrorMessage) {
        return new InputField(value, newErrorMessage);
    }

    public boolean hasError() {
        return errorMessage != null;
    }
}
