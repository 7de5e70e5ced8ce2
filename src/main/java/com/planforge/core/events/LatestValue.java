package com.planforge.core.events;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * Single-slot channel holding the most recent value.
 * <p>
 * Readers that miss intermediate values still converge on the current one. Change
 * listeners run on the writer's thread and must be quick.
 *
 * @param <T> value type, expected to be immutable
 */
public class LatestValue<T> {

    private static final Logger log = LoggerFactory.getLogger(LatestValue.class);

    private final Object monitor = new Object();
    private final CopyOnWriteArrayList<Consumer<T>> listeners = new CopyOnWriteArrayList<>();

    private T value;
    private long version;

    public LatestValue(T initial) {
        this.value = initial;
    }

    public T get() {
        synchronized (monitor) {
            return value;
        }
    }

    /** Incremented on every {@link #set}. */
    public long version() {
        synchronized (monitor) {
            return version;
        }
    }

    public void set(T newValue) {
        synchronized (monitor) {
            value = newValue;
            version++;
            monitor.notifyAll();
        }
        for (Consumer<T> listener : listeners) {
            try {
                listener.accept(newValue);
            } catch (Exception e) {
                log.warn("Latest-value listener threw: {}", e.getMessage(), e);
            }
        }
    }

    /**
     * Blocks until the version moves past {@code seenVersion} or the timeout elapses,
     * then returns the current value.
     */
    public T awaitChange(long seenVersion, Duration timeout) throws InterruptedException {
        long deadline = System.nanoTime() + timeout.toNanos();
        synchronized (monitor) {
            while (version <= seenVersion) {
                long remainingMs = (deadline - System.nanoTime()) / 1_000_000;
                if (remainingMs <= 0) {
                    break;
                }
                monitor.wait(remainingMs);
            }
            return value;
        }
    }

    public Runnable onChange(Consumer<T> listener) {
        listeners.add(listener);
        return () -> listeners.remove(listener);
    }
}
