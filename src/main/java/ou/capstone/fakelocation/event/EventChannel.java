package ou.capstone.fakelocation.event;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * One-shot, multicast notification stream.
 * <p>
 * {@link #publish} takes the listeners attached at that moment, hands the event to the
 * session executor and returns immediately. Nothing is buffered: an event published
 * with zero listeners is gone, and a listener that subscribes after the publish never
 * sees it, even if delivery has not run yet. Shutting the executor down cancels
 * deliveries that have not run yet.
 *
 * @param <T> event payload type
 */
public final class EventChannel<T> {

    private static final Logger logger = LoggerFactory.getLogger(EventChannel.class);

    private final String name;
    private final ExecutorService scope;
    private final CopyOnWriteArrayList<EventListener<T>> listeners = new CopyOnWriteArrayList<>();

    /**
     * @param name  channel name used in log output
     * @param scope executor bound to the owning session
     */
    public EventChannel(final String name, final ExecutorService scope) {
        this.name = Objects.requireNonNull(name, "name");
        this.scope = Objects.requireNonNull(scope, "scope");
    }

    public String getName() {
        return name;
    }

    /**
     * Attaches a listener. The same listener instance may be attached only once.
     *
     * @return handle that detaches the listener again
     */
    public Subscription subscribe(final EventListener<T> listener) {
        Objects.requireNonNull(listener, "listener");
        listeners.addIfAbsent(listener);
        logger.debug("Listener attached to '{}' ({} total)", name, listeners.size());
        return () -> unsubscribe(listener);
    }

    public void unsubscribe(final EventListener<T> listener) {
        if (listeners.remove(listener)) {
            logger.debug("Listener detached from '{}' ({} left)", name, listeners.size());
        }
    }

    public int getSubscriberCount() {
        return listeners.size();
    }

    /**
     * Schedules delivery of {@code event} to the listeners attached right now. Callers are
     * not expected to wait on the returned future; it completes once every one of those
     * listeners has been called. With no listener, or after the session ended, the event
     * is dropped and an already-completed future is returned.
     */
    public CompletableFuture<Void> publish(final T event) {
        if (scope.isShutdown()) {
            logger.debug("Session closed, dropping event on '{}': {}", name, event);
            return CompletableFuture.completedFuture(null);
        }
        final List<EventListener<T>> snapshot = List.copyOf(listeners);
        if (snapshot.isEmpty()) {
            logger.debug("No listeners on '{}', event dropped: {}", name, event);
            return CompletableFuture.completedFuture(null);
        }
        try {
            return CompletableFuture.runAsync(() -> deliver(snapshot, event), scope);
        } catch (RejectedExecutionException e) {
            logger.debug("Session closed while publishing on '{}', dropping {}", name, event);
            return CompletableFuture.completedFuture(null);
        }
    }

    private void deliver(final List<EventListener<T>> snapshot, final T event) {
        for (EventListener<T> listener : snapshot) {
            try {
                listener.onEvent(event);
            } catch (RuntimeException e) {
                logger.warn("Listener on '{}' failed for event {}", name, event, e);
            }
        }
    }
}
