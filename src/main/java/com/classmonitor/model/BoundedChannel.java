package com.classmonitor.model;

import java.time.Duration;
import java.util.concurrent.TimeUnit;

import reactor.core.Disposable;
import reactor.core.publisher.Mono;
import reactor.core.publisher.MonoSink;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

/**
 * Fixed-capacity, single-consumer channel between a relay and one viewer.
 *
 * Items live in a ring of slots with a read cursor and a count. When every
 * slot is taken, {@link #trySend(Object)} discards the offered item and keeps
 * the ones already queued, so a slow viewer only ever sees a short window of
 * recent frames. {@link #receive(Duration)} never blocks a thread: it completes
 * with the next item, or with {@link Received#timedOut()} once the timeout
 * elapses.
 */
public class BoundedChannel<T> {

    private final Object lock = new Object();
    private final Object[] slots;
    private final Scheduler timer;

    private int head;
    private int count;
    private boolean closed;
    private Waiter<T> waiter;

    public BoundedChannel(int capacity) {
        this(capacity, Schedulers.parallel());
    }

    public BoundedChannel(int capacity, Scheduler timer) {
        if (capacity < 1) {
            throw new IllegalArgumentException("Channel capacity must be at least 1, got " + capacity);
        }
        this.slots = new Object[capacity];
        this.timer = timer;
    }

    /**
     * Offer an item without waiting.
     *
     * @return true if the item was handed to a waiting receiver or queued,
     *         false if the channel is full or closed
     */
    public boolean trySend(T item) {
        if (item == null) {
            throw new IllegalArgumentException("Channel items must not be null");
        }
        Waiter<T> target;
        synchronized (lock) {
            if (closed) {
                return false;
            }
            if (waiter == null) {
                if (count == slots.length) {
                    return false;
                }
                slots[(head + count) % slots.length] = item;
                count++;
                return true;
            }
            target = waiter;
            waiter = null;
        }
        target.sink.success(Received.of(item));
        return true;
    }

    /**
     * Wait for the next item. The returned Mono completes with the item, or with
     * a timed-out result if nothing arrives within {@code timeout}. Cancelling
     * the subscription withdraws the pending receive.
     */
    public Mono<Received<T>> receive(Duration timeout) {
        return Mono.create(sink -> {
            Waiter<T> pending;
            synchronized (lock) {
                if (count > 0) {
                    sink.success(Received.of(poll()));
                    return;
                }
                if (closed) {
                    sink.success(Received.timedOut());
                    return;
                }
                if (waiter != null) {
                    sink.error(new IllegalStateException("Channel already has a pending receiver"));
                    return;
                }
                pending = new Waiter<>(sink);
                waiter = pending;
            }
            Disposable expiry = timer.schedule(() -> expire(pending), timeout.toMillis(), TimeUnit.MILLISECONDS);
            sink.onDispose(() -> {
                expiry.dispose();
                withdraw(pending);
            });
        });
    }

    /**
     * Close the channel. Queued items are discarded, later sends are rejected
     * and a pending receiver is released with a timed-out result.
     */
    public void close() {
        Waiter<T> pending;
        synchronized (lock) {
            if (closed) {
                return;
            }
            closed = true;
            for (int i = 0; i < slots.length; i++) {
                slots[i] = null;
            }
            count = 0;
            pending = waiter;
            waiter = null;
        }
        if (pending != null) {
            pending.sink.success(Received.timedOut());
        }
    }

    public int size() {
        synchronized (lock) {
            return count;
        }
    }

    public int capacity() {
        return slots.length;
    }

    public boolean isClosed() {
        synchronized (lock) {
            return closed;
        }
    }

    @SuppressWarnings("unchecked")
    private T poll() {
        T item = (T) slots[head];
        slots[head] = null;
        head = (head + 1) % slots.length;
        count--;
        return item;
    }

    private void expire(Waiter<T> pending) {
        synchronized (lock) {
            if (waiter != pending) {
                return;
            }
            waiter = null;
        }
        pending.sink.success(Received.timedOut());
    }

    private void withdraw(Waiter<T> pending) {
        synchronized (lock) {
            if (waiter == pending) {
                waiter = null;
            }
        }
    }

    private static final class Waiter<T> {
        private final MonoSink<Received<T>> sink;

        private Waiter(MonoSink<Received<T>> sink) {
            this.sink = sink;
        }
    }

    /**
     * Outcome of a receive: either an item or a timeout.
     */
    public record Received<T>(T item) {

        private static final Received<?> TIMED_OUT = new Received<>(null);

        public static <T> Received<T> of(T item) {
            return new Received<>(item);
        }

        @SuppressWarnings("unchecked")
        public static <T> Received<T> timedOut() {
            return (Received<T>) TIMED_OUT;
        }

        public boolean isTimeout() {
            return item == null;
        }
    }
}
