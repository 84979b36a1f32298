package ou.capstone.fakelocation.dialog;

import java.util.Optional;

/** Inputs of the "go to point" dialog. */
public enum GoToPointField {
    LATITUDE("latitude"),
    LONGITUDE("longitude");

    private final String key;

    GoToPointField(final String key) {
        this.key = key;
    }

    /** @return the key UI bindings use for this field */
    public String key() {
        return key;
    }

    /**
     * Resolves a UI field key. Keys are case-sensitive.
     *
     * @param key e.g. "latitude"
     * @return the matching field, or empty for an unknown key
     */
    public static Optional<GoToPointField> fromKey(final String key) {
        for (GoToPointField field : values()) {
            if (field.key.equals(key)) {
                return Optional.of(field);
            }
        }
        return Optional.empty();
    }
}
