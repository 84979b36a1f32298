package ou.capstone.fakelocation.persistence;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;

import org.junit.jupiter.api.Test;

import ou.capstone.fakelocation.map.MapController;
import ou.capstone.fakelocation.model.Coordinate;
import ou.capstone.fakelocation.model.FavoriteLocation;

class InMemoryPreferencesRepositoryTest {

    @Test
    void storesWhatTheControllerWrites() {
        InMemoryPreferencesRepository preferences = new InMemoryPreferencesRepository();
        try (MapController controller = new MapController(preferences)) {
            controller.togglePlaying();
            controller.updateClickedLocation(new Coordinate(10.5, 20.5));
            controller.addFavoriteLocation(new FavoriteLocation("Spot", 10.5, 20.5));
        }

        assertTrue(preferences.isPlaying());
        assertEquals(new Coordinate(10.5f, 20.5f), preferences.getLastClickedLocation().orElseThrow());
        assertEquals(List.of(new FavoriteLocation("Spot", 10.5, 20.5)), preferences.getFavorites());
    }

    @Test
    void newSessionRestoresPreviousOne() {
        InMemoryPreferencesRepository preferences = new InMemoryPreferencesRepository();
        try (MapController first = new MapController(preferences)) {
            first.togglePlaying();
            first.updateClickedLocation(new Coordinate(-12.25, 130.5));
        }

        try (MapController second = new MapController(preferences)) {
            assertFalse(second.getState().playing(), "New session starts from defaults");

            second.restorePersistedState();

            assertTrue(second.getState().playing());
            assertEquals(new Coordinate(-12.25, 130.5), second.getState().lastClickedLocation());
            assertTrue(second.isFabClickable());
        }
    }

    @Test
    void stoppingForgetsClickedLocation() {
        InMemoryPreferencesRepository preferences = new InMemoryPreferencesRepository();
        try (MapController controller = new MapController(preferences)) {
            controller.togglePlaying();
            controller.updateClickedLocation(new Coordinate(1.0, 1.0));
            controller.togglePlaying();
        }

        assertFalse(preferences.isPlaying());
        assertTrue(preferences.getLastClickedLocation().isEmpty());
    }
}
