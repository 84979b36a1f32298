package ou.capstone.fakelocation.map;

/** Receives the parsed coordinates of a dialog that passed validation. */
@FunctionalInterface
public interface CoordinateCallback {

    void accept(double latitude, double longitude);
}
