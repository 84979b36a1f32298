package ou.capstone.fakelocation.dialog;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Optional;

import org.junit.jupiter.api.Test;

class DialogStateTest {

    @Test
    void inputFieldCopiesKeepTheOtherComponent() {
        InputField field = new InputField("12", "bad");

        assertEquals(new InputField("13", "bad"), field.withValue("13"));
        assertEquals(new InputField("12", null), field.withErrorMessage(null));
        assertTrue(field.hasError());
        assertFalse(InputField.EMPTY.hasError());
        assertEquals("", new InputField(null, null).value());
    }

    @Test
    void goToPointWithValueKeepsError() {
        GoToPointState state = GoToPointState.EMPTY.withErrors("lat error", null);

        GoToPointState updated = state.withValue(GoToPointField.LATITUDE, "45");

        assertEquals("45", updated.latitude().value());
        assertEquals("lat error", updated.latitude().errorMessage());
        assertEquals(InputField.EMPTY, updated.longitude());
        assertEquals(updated.latitude(), updated.field(GoToPointField.LATITUDE));
    }

    @Test
    void favoritesWithCoordinateValuesLeavesNameAndErrors() {
        FavoritesInputState state = new FavoritesInputState(
                new InputField("Home", "name error"),
                new InputField("1", "lat error"),
                new InputField("2", null));

        FavoritesInputState updated = state.withCoordinateValues("10.0", "");

        assertEquals(state.name(), updated.name());
        assertEquals(new InputField("10.0", "lat error"), updated.latitude());
        assertEquals(new InputField("", null), updated.longitude());
    }

    @Test
    void favoritesWithErrorsReplacesAllThree() {
        FavoritesInputState state = FavoritesInputState.EMPTY
                .withValue(FavoritesField.NAME, "Home")
                .withErrors(null, "lat", "lon");

        assertNull(state.name().errorMessage());
        assertEquals("Home", state.field(FavoritesField.NAME).value());
        assertEquals("lat", state.latitude().errorMessage());
        assertEquals("lon", state.longitude().errorMessage());
    }

    @Test
    void fieldKeysResolveCaseSensitively() {
        assertEquals(Optional.of(GoToPointField.LONGITUDE), GoToPointField.fromKey("longitude"));
        assertEquals(Optional.of(FavoritesField.NAME), FavoritesField.fromKey("name"));
        assertTrue(GoToPointField.fromKey("name").isEmpty());
        assertTrue(FavoritesField.fromKey("Latitude").isEmpty());
        assertTrue(FavoritesField.fromKey(null).isEmpty());
    }

    @Test
    void everyFieldRoundTripsThroughItsKey() {
        for (GoToPointField field : GoToPointField.values()) {
            assertEquals(Optional.of(field), GoToPointField.fromKey(field.key()));
        }
        for (FavoritesField field : FavoritesField.values()) {
            assertEquals(Optional.of(field), FavoritesField.fromKey(field.key()));
        }
        assertEquals("name", FavoritesField.NAME.key());
    }
}
