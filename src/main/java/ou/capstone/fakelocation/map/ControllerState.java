package ou.capstone.fakelocation.map;

import ou.capstone.fakelocation.dialog.FavoritesInputState;
import ou.capstone.fakelocation.dialog.GoToPointState;
import ou.capstone.fakelocation.model.Coordinate;

/**
 * Everything the map screen renders from. Immutable; {@link MapController} swaps in a new
 * instance for every change.
 *
 * @param playing                     simulated location active
 * @param lastClickedLocation         last map tap, null if none
 * @param userLocation                real device location, null until first fix
 * @param loading                     map still loading
 * @param goToPointDialogVisible      "go to point" dialog shown
 * @param addToFavoritesDialogVisible "add to favorites" dialog shown
 * @param goToPoint                   "go to point" inputs
 * @param favoritesInput              "add to favorites" inputs
 */
public record ControllerState(boolean playing,
                              Coordinate lastClickedLocation,
                              Coordinate userLocation,
                              boolean loading,
                              boolean goToPointDialogVisible,
                              boolean addToFavoritesDialogVisible,
                              GoToPointState goToPoint,
                              FavoritesInputState favoritesInput) {

    public static final ControllerState INITIAL = new ControllerState(
            false, null, null, true, false, false,
            GoToPointState.EMPTY, FavoritesInputState.EMPTY);

    public ControllerState {
        goToPoint = (goToPoint == null) ? GoToPointState.EMPTY : goToPoint;
        favoritesInput = (favoritesInput == null) ? FavoritesInputState.EMPTY : favoritesInput;
    }

    /** The floating action button only works once a point was picked on the map. */
    public boolean isFabClickable() {
        return lastClickedLocation != null;
    }

    public ControllerState withPlaying(final boolean value) {
        return new ControllerState(value, lastClickedLocation, userLocation, loading,
                goToPointDialogVisible, addToFavoritesDialogVisible, goToPoint, favoritesInput);
    }

    public ControllerState withLastClickedLocation(final Coordinate value) {
        return new ControllerState(playing, value, userLocation, loading,
                goToPointDialogVisible, addToFavoritesDialogVisible, goToPoint, favoritesInput);
    }

    public ControllerState withUserLocation(final Coordinate value) {
        return new ControllerState(playing, lastClickedLocation, value, loading,
                goToPointDialogVisible, addToFavoritesDialogVisible, goToPoint, favoritesInput);
    }

    public ControllerState withLoading(final boolean value) {
        return new ControllerState(playing, lastClickedLocation, userLocation, value,
                goToPointDialogVisible, addToFavoritesDialogVisible, goToPoint, favoritesInput);
    }

    public ControllerState withGoToPointDialogVisible(final boolean value) {
        return new ControllerState(playing, lastClickedLocation, userLocation, loading,
                value, addToFavoritesDialogVisible, goToPoint, favoritesInput);
    }

    public ControllerState withAddToFavoritesDialogVisible(final boolean value) {
        return new ControllerState(playing, lastClickedLocation, userLocation, loading,
                goToPointDialogVisible, value, goToPoint, favoritesInput);
    }

    public ControllerState withGoToPoint(final GoToPointState value) {
        return new ControllerState(playing, lastClickedLocation, userLocation, loading,
                goToPointDialogVisible, addToFavoritesDialogVisible, value, favoritesInput);
    }

    public ControllerState withFavoritesInput(final FavoritesInputState value) {
        return new ControllerState(playing, lastClickedLocation, userLocation, loading,
                goToPointDialogVisible, addToFavoritesDialogVisible, goToPoint, value);
    }
}
