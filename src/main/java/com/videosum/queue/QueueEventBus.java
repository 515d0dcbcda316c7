package com.videosum.queue;

import com.videosum.model.QueueEvent;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentSkipListMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Consumer;

/**
 * In-process fan-out of queue events to live observers.
 *
 * Delivery is synchronous on the emitting thread, in subscription order, with no buffering:
 * a handler registered after an event was emitted never sees it.
 */
@Component
@Slf4j
public class QueueEventBus {

    private final QueueStore queueStore;
    private final AtomicLong nextHandle = new AtomicLong();
    private final Map<Long, Consumer<QueueEvent>> handlers = new ConcurrentSkipListMap<>();

    public QueueEventBus(QueueStore queueStore) {
        this.queueStore = queueStore;
    }

    /**
     * Registers a handler for all subsequent events.
     */
    public Subscription subscribe(Consumer<QueueEvent> handler) {
        long handle = nextHandle.incrementAndGet();
        handlers.put(handle, handler);
        log.debug("Queue event subscriber {} registered ({} active)", handle, handlers.size());
        return () -> {
            if (handlers.remove(handle) != null) {
                log.debug("Queue event subscriber {} removed ({} active)", handle, handlers.size());
            }
        };
    }

    /**
     * Reloads the queue document and sends it to every subscriber.
     * Used after the queue was changed outside the processing loop.
     */
    public void broadcastState() {
        emit(QueueEvent.state(queueStore.load()));
    }

    public int getSubscriberCount() {
        return handlers.size();
    }

    void emit(QueueEvent event) {
        // handlers may subscribe or unsubscribe while we deliver
        List<Consumer<QueueEvent>> snapshot = new ArrayList<>(handlers.values());
        for (Consumer<QueueEvent> handler : snapshot) {
            try {
                handler.accept(event);
            } catch (RuntimeException e) {
                log.warn("Queue event subscriber failed on {} event: {}", event.getType(), e.getMessage(), e);
            }
        }
    }

    /**
     * Handle returned by {@link #subscribe}; calling it more than once is harmless.
     */
    @FunctionalInterface
    public interface Subscription {
        void unsubscribe();
    }
}
