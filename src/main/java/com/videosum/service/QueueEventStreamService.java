package com.videosum.service;

import com.videosum.model.QueueEvent;
import com.videosum.queue.QueueEventBus;
import com.videosum.queue.QueueStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.MediaType;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.io.IOException;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Bridges queue events to Server-Sent Events connections.
 * Each connection starts with a full state snapshot since the bus does not replay.
 */
@Service
@Slf4j
public class QueueEventStreamService {

    private final QueueEventBus eventBus;
    private final QueueStore queueStore;
    private final long timeoutMs;
    private final Map<SseEmitter, QueueEventBus.Subscription> connections = new ConcurrentHashMap<>();

    public QueueEventStreamService(QueueEventBus eventBus,
                                   QueueStore queueStore,
                                   @Value("${videosum.events.timeout-ms:0}") long timeoutMs) {
        this.eventBus = eventBus;
        this.queueStore = queueStore;
        this.timeoutMs = timeoutMs;
    }

    public SseEmitter connect() {
        SseEmitter emitter = new SseEmitter(timeoutMs);
        send(emitter, QueueEvent.state(queueStore.load()));

        connections.put(emitter, eventBus.subscribe(event -> send(emitter, event)));
        emitter.onCompletion(() -> disconnect(emitter));
        emitter.onTimeout(() -> {
            disconnect(emitter);
            emitter.complete();
        });
        emitter.onError(e -> disconnect(emitter));

        log.info("Queue event stream connected ({} open)", connections.size());
        return emitter;
    }

    @Scheduled(fixedRateString = "${videosum.events.heartbeat-ms:30000}")
    public void heartbeat() {
        for (SseEmitter emitter : connections.keySet()) {
            try {
                emitter.send(SseEmitter.event().comment("heartbeat"));
            } catch (IOException | IllegalStateException e) {
                disconnect(emitter);
            }
        }
    }

    public int getConnectionCount() {
        return connections.size();
    }

    private void send(SseEmitter emitter, QueueEvent event) {
        try {
            emitter.send(SseEmitter.event().data(event, MediaType.APPLICATION_JSON));
        } catch (IOException | IllegalStateException e) {
            log.debug("Dropping queue event stream: {}", e.getMessage());
            disconnect(emitter);
        }
    }

    private void disconnect(SseEmitter emitter) {
        QueueEventBus.Subscription subscription = connections.remove(emitter);
        if (subscription != null) {
            subscription.unsubscribe();
            log.info("Queue event stream closed ({} open)", connections.size());
        }
    }
}
