package ou.capstone.fakelocation.event;

/** Payload-free requests sent to the map surface. */
public enum MapSignal {
    CENTER_MAP
}
