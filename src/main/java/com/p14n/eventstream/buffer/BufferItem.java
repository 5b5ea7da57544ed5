package com.p14n.eventstream.buffer;

import java.util.Set;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.atomic.AtomicReference;

import com.google.common.util.concurrent.MoreExecutors;
import com.p14n.eventstream.data.Events;

import io.grpc.Context;
import io.grpc.Contexts;
import io.grpc.Status;

/**
 * One batch in the event buffer and the link to the batch after it.
 *
 * <p>
 * Items are immutable once created and shared by every subscription reading
 * the buffer. The link is set exactly once, when the following batch is
 * appended.
 * </p>
 */
public final class BufferItem {

    private final Events events;
    private final AtomicReference<BufferItem> link = new AtomicReference<>();
    private final Set<Runnable> waiters = ConcurrentHashMap.newKeySet();

    BufferItem(Events events) {
        this.events = events;
    }

    public Events events() {
        return events;
    }

    public long index() {
        return events.index();
    }

    void link(BufferItem next) {
        if (!link.compareAndSet(null, next)) {
            throw new IllegalStateException("Buffer item at index " + index() + " is already linked");
        }
        for (Runnable waiter : waiters) {
            waiter.run();
        }
    }

    /**
     * Waits for the item that follows this one.
     *
     * <p>
     * Every wake-up source is registered for this call only and removed before
     * it returns.
     * </p>
     *
     * @param ctx         caller context, cancelling it aborts the wait
     * @param closeSignal subscription close signal, firing it aborts the wait
     * @return the following item
     * @throws io.grpc.StatusRuntimeException with CANCELLED or DEADLINE_EXCEEDED
     *                                        if the context was cancelled
     * @throws CancellationException          if the close signal fired
     * @throws InterruptedException           if the waiting thread was
     *                                        interrupted
     */
    public BufferItem next(Context ctx, CloseSignal closeSignal) throws InterruptedException {
        BufferItem ready = link.get();
        if (ready != null) {
            return ready;
        }

        CountDownLatch wake = new CountDownLatch(1);
        Runnable wakeUp = wake::countDown;
        Context.CancellationListener listener = c -> wake.countDown();
        waiters.add(wakeUp);
        closeSignal.addListener(wakeUp);
        ctx.addListener(listener, MoreExecutors.directExecutor());
        try {
            if (link.get() == null && !closeSignal.isFired()) {
                wake.await();
            }
        } finally {
            ctx.removeListener(listener);
            closeSignal.removeListener(wakeUp);
            waiters.remove(wakeUp);
        }

        if (closeSignal.isFired()) {
            throw new CancellationException("Wait aborted by close signal");
        }
        ready = link.get();
        if (ready != null) {
            return ready;
        }
        Status status = Contexts.statusFromCancelled(ctx);
        throw (status == null ? Status.CANCELLED : status).asRuntimeException();
    }

    /**
     * Returns the following item without waiting.
     *
     * @return the following item, or null if none has been appended yet
     */
    public BufferItem nextNoBlock() {
        return link.get();
    }

    int waiterCount() {
        return waiters.size();
    }
}
