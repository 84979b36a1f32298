package ou.capstone.fakelocation.dialog;

import java.util.Optional;

/** Inputs of the "add to favorites" dialog. */
public enum FavoritesField {
    NAME("name"),
    LATITUDE("latitude"),
    LONGITUDE("longitude");

    private final String key;

    FavoritesField(final String key) {
        this.key = key;
    }

    public String key() {
        return key;
    }

    public static Optional<FavoritesField> fromKey(final String key) {
        for (FavoritesField field : values()) {
            if (field.key.equals(key)) {
                return Optional.of(field);
            }
        }
        return Optional.empty();
    }
}
