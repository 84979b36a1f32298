package ou.capstone.fakelocation.map;

/**
 * Observer of {@link MapController} state replacements, called on the mutating thread.
 */
@FunctionalInterface
public interface StateListener {

    void onStateChanged(ControllerState previous, ControllerState current);
}
