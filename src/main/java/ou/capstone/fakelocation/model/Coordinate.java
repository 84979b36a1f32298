package ou.capstone.fakelocation.model;

import java.util.Locale;

/**
 * Immutable geographic coordinate (latitude/longitude in decimal degrees).
 * <p>
 * No range check happens here: map taps and restored preferences are taken as-is,
 * and the dialog validators decide what the user may submit.
 */
public final class Coordinate {

    public static final double MIN_LATITUDE = -90.0;
    public static final double MAX_LATITUDE = 90.0;
    public static final double MIN_LONGITUDE = -180.0;
    public static final double MAX_LONGITUDE = 180.0;

    public final double latDeg;
    public final double lonDeg;

    /**
     * @param latDeg latitude in degrees
     * @param lonDeg longitude in degrees
     */
    public Coordinate(final double latDeg, final double lonDeg) {
        this.latDeg = latDeg;
        this.lonDeg = lonDeg;
    }

    /** @return latitude in degrees */
    public double getLatitude() {
        return latDeg;
    }

    /** @return longitude in degrees */
    public double getLongitude() {
        return lonDeg;
    }

    /**
     * @return true if latitude is in [-90, 90] and longitude in [-180, 180]
     */
    public boolean isWithinBounds() {
        return latDeg >= MIN_LATITUDE && latDeg <= MAX_LATITUDE
                && lonDeg >= MIN_LONGITUDE && lonDeg <= MAX_LONGITUDE;
    }

    @Override
    public boolean equals(final Object o) {
        if (this == o) return true;
        if (!(o instanceof Coordinate)) return false;
        final Coordinate other = (Coordinate) o;
        return Double.compare(latDeg, other.latDeg) == 0
                && Double.compare(lonDeg, other.lonDeg) == 0;
    }

    @Override
    public int hashCode() {
        return 31 * Double.hashCode(latDeg) + Double.hashCode(lonDeg);
    }

    @Override
    public String toString() {
        return String.format(Locale.US, "(%.6f, %.6f)", latDeg, lonDeg);
    }
}
