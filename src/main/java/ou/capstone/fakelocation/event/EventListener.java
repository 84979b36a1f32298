package ou.capstone.fakelocation.event;

/**
 * Receives events from an {@link EventChannel}.
 */
@FunctionalInterface
public interface EventListener<T> {

    /**
     * Called on the channel's delivery thread, once per publish.
     *
     * @param event the published value
     */
    void onEvent(T event);
}
