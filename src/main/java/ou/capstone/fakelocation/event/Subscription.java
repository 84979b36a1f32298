package ou.capstone.fakelocation.event;

/**
 * Handle returned by {@link EventChannel#subscribe}; closing it detaches the listener.
 */
@FunctionalInterface
public interface Subscription extends AutoCloseable {

    void unsubscribe();

    @Override
    default void close() {
        unsubscribe();
    }
}
