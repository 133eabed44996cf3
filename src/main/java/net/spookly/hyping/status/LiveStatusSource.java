package net.spookly.hyping.status;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicReference;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Broadcasts the latest status record to any number of readers.
 * <p>
 * Readers see an atomically swapped immutable snapshot. Publishing is serialized so versions
 * grow strictly and listeners observe them in order; readers never wait for it.
 */
public final class LiveStatusSource implements StatusSource {
    private static final Logger LOGGER = Logger.getLogger(LiveStatusSource.class.getName());

    private final AtomicReference<Snapshot> current;
    private final List<StatusListener> listeners = new CopyOnWriteArrayList<>();
    private final Object publishLock = new Object();

    public LiveStatusSource(StatusRecord initial) {
        this.current = new AtomicReference<>(new Snapshot(Objects.requireNonNull(initial, "initial"), 0L));
    }

    @Override
    public StatusRecord current() {
        return current.get().record;
    }

    @Override
    public long version() {
        return current.get().version;
    }

    /**
     * Make {@code record} the current value and notify listeners.
     *
     * @return the version assigned to the record
     */
    public long publish(StatusRecord record) {
        Objects.requireNonNull(record, "record");
        synchronized (publishLock) {
            Snapshot next = new Snapshot(record, current.get().version + 1);
            current.set(next);
            for (StatusListener listener : listeners) {
                notifyListener(listener, next);
            }
            return next.version;
        }
    }

    @Override
    public StatusSubscription subscribe(StatusListener listener) {
        Objects.requireNonNull(listener, "listener");
        listeners.add(listener);
        return () -> listeners.remove(listener);
    }

    int listenerCount() {
        return listeners.size();
    }

    private void notifyListener(StatusListener listener, Snapshot snapshot) {
        try {
            listener.onStatus(snapshot.record, snapshot.version);
        } catch (RuntimeException e) {
            LOGGER.log(Level.WARNING, "Status listener failed for version " + snapshot.version, e);
        }
    }

    private static final class Snapshot {
        private final StatusRecord record;
        private final long version;

        private Snapshot(StatusRecord record, long version) {
            this.record = record;
            this.version = version;
        }
    }
}
