package ou.capstone.fakelocation.map;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import ou.capstone.fakelocation.dialog.FavoritesField;
import ou.capstone.fakelocation.dialog.FavoritesInputState;
import ou.capstone.fakelocation.dialog.GoToPointField;
import ou.capstone.fakelocation.dialog.GoToPointState;
import ou.capstone.fakelocation.event.EventChannel;
import ou.capstone.fakelocation.event.MapSignal;
import ou.capstone.fakelocation.model.Coordinate;
import ou.capstone.fakelocation.model.FavoriteLocation;
import ou.capstone.fakelocation.persistence.PreferencesRepository;
import ou.capstone.fakelocation.validation.InputValidator;

/**
 * Presentation state of the map screen for one screen session.
 * <p>
 * All reads and writes are expected on the UI thread; nothing here is synchronized.
 * Mutations replace the held {@link ControllerState} and notify {@link StateListener}s
 * before returning. Changes that must survive a restart are written to the
 * {@link PreferencesRepository} inline.
 * <p>
 * The two event channels deliver on a single background thread owned by this controller.
 * {@link #close()} ends the session and cancels deliveries that have not run yet.
 */
public class MapController implements AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(MapController.class);

    private final PreferencesRepository preferences;
    private final ExecutorService sessionScope;
    private final EventChannel<Coordinate> goToPointEvents;
    private final EventChannel<MapSignal> centerMapEvents;
    private final List<StateListener> stateListeners = new CopyOnWriteArrayList<>();

    private ControllerState state = ControllerState.INITIAL;

    public MapController(final PreferencesRepository preferences) {
        this(preferences, Executors.newSingleThreadExecutor(runnable -> {
            final Thread thread = new Thread(runnable, "map-events");
            thread.setDaemon(true);
            return thread;
        }));
    }

    /**
     * @param preferences  persistence gateway
     * @param sessionScope executor the event channels deliver on; shut down by {@link #close()}
     */
    public MapController(final PreferencesRepository preferences, final ExecutorService sessionScope) {
        this.preferences = Objects.requireNonNull(preferences, "preferences");
        this.sessionScope = Objects.requireNonNull(sessionScope, "sessionScope");
        this.goToPointEvents = new EventChannel<>("go-to-point", sessionScope);
        this.centerMapEvents = new EventChannel<>("center-map", sessionScope);
    }

    // ---- read access ----

    public ControllerState getState() {
        return state;
    }

    public boolean isFabClickable() {
        return state.isFabClickable();
    }

    /** Coordinates the map should pan to. */
    public EventChannel<Coordinate> goToPointEvents() {
        return goToPointEvents;
    }

    /** Requests to center the map on the user. */
    public EventChannel<MapSignal> centerMapEvents() {
        return centerMapEvents;
    }

    public void addStateListener(final StateListener listener) {
        stateListeners.add(Objects.requireNonNull(listener, "listener"));
    }

    public void removeStateListener(final StateListener listener) {
        stateListeners.remove(listener);
    }

    // ---- simulation and locations ----

    /**
     * Flips the simulation flag. Stopping also forgets the last clicked location.
     */
    public void togglePlaying() {
        final boolean playing = !state.playing();
        setState(state.withPlaying(playing));
        if (!playing) {
            updateClickedLocation(null);
        }
        preferences.saveIsPlaying(playing);
        logger.info("Simulation {}", playing ? "started" : "stopped");
    }

    public void updateUserLocation(final Coordinate location) {
        setState(state.withUserLocation(location));
    }

    /**
     * @param location tapped point, or null to clear it
     */
    public void updateClickedLocation(final Coordinate location) {
        setState(state.withLastClickedLocation(location));
        if (location != null) {
            preferences.saveLastClickedLocation((float) location.getLatitude(), (float) location.getLongitude());
            logger.debug("Clicked location set to {}", location);
        } else {
            preferences.clearLastClickedLocation();
            logger.debug("Clicked location cleared");
        }
    }

    public void addFavoriteLocation(final FavoriteLocation favorite) {
        preferences.addFavorite(favorite);
        logger.info("Favorite added: {}", favorite);
    }

    /**
     * Loads the simulation flag and last clicked location saved by an earlier session.
     * Nothing is written back.
     */
    public void restorePersistedState() {
        final boolean playing = preferences.isPlaying();
        final Coordinate lastClicked = preferences.getLastClickedLocation().orElse(null);
        setState(state.withPlaying(playing).withLastClickedLocation(lastClicked));
        logger.info("Restored session: playing={}, lastClickedLocation={}", playing, lastClicked);
    }

    public void setLoadingFinished() {
        setState(state.withLoading(false));
    }

    // ---- dialog visibility ----
    // The two dialogs are independent; showing one does not hide the other.

    public void showGoToPointDialog() {
        setState(state.withGoToPointDialogVisible(true));
    }

    public void hideGoToPointDialog() {
        setState(state.withGoToPointDialogVisible(false));
    }

    public void showAddToFavoritesDialog() {
        setState(state.withAddToFavoritesDialogVisible(true));
    }

    public void hideAddToFavoritesDialog() {
        setState(state.withAddToFavoritesDialogVisible(false));
    }

    // ---- go to point ----

    public void updateGoToPointField(final GoToPointField field, final String value) {
        setState(state.withGoToPoint(state.goToPoint().withValue(field, value)));
    }

    /**
     * Key-based variant for UI bindings. Unknown keys leave the state untouched.
     */
    public void updateGoToPointField(final String key, final String value) {
        GoToPointField.fromKey(key).ifPresentOrElse(
                field -> updateGoToPointField(field, value),
                () -> logger.debug("Ignoring update for unknown go-to-point field '{}'", key));
    }

    /**
     * Validates both inputs, writes the resulting errors back, and calls {@code onSuccess}
     * with the parsed values when neither has an error.
     */
    public void validateAndGo(final CoordinateCallback onSuccess) {
        final GoToPointState current = state.goToPoint();
        final String latitudeError = InputValidator.validateLatitude(current.latitude().value());
        final String longitudeError = InputValidator.validateLongitude(current.longitude().value());

        setState(state.withGoToPoint(current.withErrors(latitudeError, longitudeError)));

        if (latitudeError == null && longitudeError == null) {
            onSuccess.accept(InputValidator.parseValidated(current.latitude().value()),
                    InputValidator.parseValidated(current.longitude().value()));
        } else {
            logger.debug("Go to point rejected: latitudeError={}, longitudeError={}", latitudeError, longitudeError);
        }
    }

    /** Asks the map to pan to the given point. Delivered asynchronously. */
    public void goToPoint(final double latitude, final double longitude) {
        goToPointEvents.publish(new Coordinate(latitude, longitude));
    }

    public void clearGoToPointInputs() {
        setState(state.withGoToPoint(GoToPointState.EMPTY));
    }

    // ---- add to favorites ----

    public void updateAddToFavoritesField(final FavoritesField field, final String value) {
        setState(state.withFavoritesInput(state.favoritesInput().withValue(field, value)));
    }

    public void updateAddToFavoritesField(final String key, final String value) {
        FavoritesField.fromKey(key).ifPresentOrElse(
                field -> updateAddToFavoritesField(field, value),
                () -> logger.debug("Ignoring update for unknown favorites field '{}'", key));
    }

    /**
     * Fills the latitude/longitude inputs from the map marker. A missing value becomes an
     * empty input. Error messages and the name are kept.
     */
    public void prefillCoordinatesFromMarker(final Double latitude, final Double longitude) {
        final String latitudeValue = (latitude == null) ? "" : latitude.toString();
        final String longitudeValue = (longitude == null) ? "" : longitude.toString();
        setState(state.withFavoritesInput(
                state.favoritesInput().withCoordinateValues(latitudeValue, longitudeValue)));
    }

    /**
     * Validates name, latitude and longitude independently, writes all three errors back,
     * and calls {@code onSuccess} with the trimmed name and parsed values when all pass.
     */
    public void validateAndAddFavorite(final FavoriteCallback onSuccess) {
        final FavoritesInputState current = state.favoritesInput();
        final String latitudeError = InputValidator.validateLatitude(current.latitude().value());
        final String longitudeError = InputValidator.validateLongitude(current.longitude().value());
        final String nameError = InputValidator.validateName(current.name().value());

        setState(state.withFavoritesInput(current.withErrors(nameError, latitudeError, longitudeError)));

        if (nameError == null && latitudeError == null && longitudeError == null) {
            onSuccess.accept(current.name().value().trim(),
                    InputValidator.parseValidated(current.latitude().value()),
                    InputValidator.parseValidated(current.longitude().value()));
        } else {
            logger.debug("Favorite rejected: nameError={}, latitudeError={}, longitudeError={}",
                    nameError, latitudeError, longitudeError);
        }
    }

    public void clearAddToFavoritesInputs() {
        setState(state.withFavoritesInput(FavoritesInputState.EMPTY));
    }

    // ---- center map ----

    public void triggerCenterMapEvent() {
        centerMapEvents.publish(MapSignal.CENTER_MAP);
    }

    /**
     * Ends the session. Undelivered events are cancelled; state stays readable.
     */
    @Override
    public void close() {
        final List<Runnable> cancelled = sessionScope.shutdownNow();
        logger.info("Map session closed ({} pending event(s) cancelled)", cancelled.size());
    }

    private void setState(final ControllerState next) {
        if (next.equals(state)) {
            return;
        }
        final ControllerState previous = state;
        state = next;
        for (StateListener listener : stateListeners) {
            listener.onStateChanged(previous, next);
        }
    }
}
