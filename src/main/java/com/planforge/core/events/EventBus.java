package com.planforge.core.events;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * In-memory broadcast of events to every live subscriber.
 * <p>
 * Each subscriber owns a bounded queue. Publishing never blocks: when a subscriber's queue
 * is full its oldest entry is dropped and counted as lag, so a slow or absent reader loses
 * events but never holds up the writer. Every subscriber sees the events it does receive
 * in publish order.
 *
 * @param <E> event type
 */
public class EventBus<E> {

    private static final Logger log = LoggerFactory.getLogger(EventBus.class);

    public static final int DEFAULT_CAPACITY = 64;

    private final int capacity;

    private final CopyOnWriteArrayList<QueueSubscription> subscribers = new CopyOnWriteArrayList<>();

    public EventBus() {
        this(DEFAULT_CAPACITY);
    }

    public EventBus(int capacity) {
        if (capacity < 1) {
            throw new IllegalArgumentException("capacity must be positive");
        }
        this.capacity = capacity;
    }

    /**
     * Publish an event to all current subscribers.
     *
     * @param event the event to publish
     * @return the number of subscribers it was offered to
     */
    public int publish(E event) {
        for (QueueSubscription subscriber : subscribers) {
            subscriber.offer(event);
        }
        return subscribers.size();
    }

    /**
     * Subscribe to events published from now on.
     *
     * @return a {@link Subscription} to read from and close
     */
    public Subscription<E> subscribe() {
        var subscription = new QueueSubscription();
        subscribers.add(subscription);
        log.debug("Subscribed to event bus ({} subscriber(s))", subscribers.size());
        return subscription;
    }

    public int subscriberCount() {
        return subscribers.size();
    }

    /**
     * Handle for reading and cancelling a subscription.
     */
    public interface Subscription<E> extends AutoCloseable {

        /** Next event, or null if none arrives within the timeout. */
        E poll(Duration timeout) throws InterruptedException;

        /** Everything currently queued, oldest first. */
        List<E> drain();

        /** Events dropped for this subscriber because its queue was full. */
        long lagged();

        void unsubscribe();

        @Override
        default void close() {
            unsubscribe();
        }
    }

    private final class QueueSubscription implements Subscription<E> {

        private final ArrayBlockingQueue<E> queue = new ArrayBlockingQueue<>(capacity);
        private final AtomicLong lagged = new AtomicLong();

        void offer(E event) {
            while (!queue.offer(event)) {
                if (queue.poll() != null) {
                    long total = lagged.incrementAndGet();
                    if (total == 1 || total % capacity == 0) {
                        log.warn("Event subscriber is lagging, {} event(s) dropped so far", total);
                    }
                }
            }
        }

        @Override
        public E poll(Duration timeout) throws InterruptedException {
            return queue.poll(timeout.toMillis(), TimeUnit.MILLISECONDS);
        }

        @Override
        public List<E> drain() {
            List<E> events = new ArrayList<>();
            queue.drainTo(events);
            return events;
        }

        @Override
        public long lagged() {
            return lagged.get();
        }

        @Override
        public void unsubscribe() {
            subscribers.remove(this);
        }
    }
}
