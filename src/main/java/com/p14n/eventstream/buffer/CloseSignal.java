package com.p14n.eventstream.buffer;

import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * One-shot broadcast used to abort waits on the event buffer.
 *
 * <p>
 * The signal carries no data. Once fired it stays fired, and every current
 * and future waiter observes it. Waiters register a listener for the length
 * of one wait and remove it afterwards, so nothing accumulates on a signal
 * that never fires.
 * </p>
 */
public final class CloseSignal {

    private final AtomicBoolean fired = new AtomicBoolean(false);
    private final Set<Runnable> listeners = ConcurrentHashMap.newKeySet();

    /**
     * Fires the signal and runs every registered listener.
     *
     * @return true if this call fired it, false if it had already fired
     */
    public boolean fire() {
        if (!fired.compareAndSet(false, true)) {
            return false;
        }
        for (Runnable listener : listeners) {
            listener.run();
        }
        return true;
    }

    public boolean isFired() {
        return fired.get();
    }

    /**
     * Registers a listener run when the signal fires, or straight away if it
     * already has. A listener racing with {@link #fire} may run twice, so it
     * must be idempotent.
     */
    public void addListener(Runnable listener) {
        listeners.add(listener);
        if (fired.get()) {
            listener.run();
        }
    }

    public void removeListener(Runnable listener) {
        listeners.remove(listener);
    }

    int listenerCount() {
        return listeners.size();
    }
}
