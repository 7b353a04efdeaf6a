package com.attendance.tracker.service.streaming;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.lang.Nullable;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * SSE hub for notifications that are not a reply to a request:
 * collection finished, session timed out, absence batch written, holiday changes.
 * <p>
 * Subscribers name exact topics ("attendance.recorded") or prefixes ("attendance.*").
 * Single node only.
 */
@Service
@Slf4j
public class StreamGateway {

    private static final long DEFAULT_TIMEOUT_MS = 30L * 60L * 1000L;
    private static final Duration HEARTBEAT_EVERY = Duration.ofSeconds(20);

    @Autowired(required = false)
    @Nullable
    private TaskScheduler taskScheduler;

    private final AtomicBoolean heartbeatScheduled = new AtomicBoolean(false);

    /** Emitter id → emitter */
    private final Map<String, SseEmitter> emitters = new ConcurrentHashMap<>();
    /** Emitter id → exact topics */
    private final Map<String, Set<String>> emitterTopics = new ConcurrentHashMap<>();
    /** Emitter id → prefixes, stored with the trailing dot */
    private final Map<String, Set<String>> emitterPrefixes = new ConcurrentHashMap<>();

    /**
     * Broadcast to every subscriber whose topics or prefixes match. Never throws.
     */
    public <T> void send(String topic, T payload) {
        if (!StringUtils.hasText(topic) || emitters.isEmpty()) return;

        List<String> targets = new ArrayList<>();
        for (String id : emitters.keySet()) {
            if (matches(id, topic)) targets.add(id);
        }

        for (String id : targets) {
            SseEmitter em = emitters.get(id);
            if (em == null) continue;
            try {
                em.send(SseEmitter.event().name(topic).data(payload));
            } catch (IOException | IllegalStateException ex) {
                log.debug("SSE send failed; pruning emitter {}", id, ex);
                removeEmitter(id);
            }
        }
    }

    /**
     * @param timeoutMs     null or <=0 uses 30 minutes
     * @param subscriptions exact topics and/or "prefix.*" patterns
     */
    public SseEmitter subscribe(@Nullable Long timeoutMs, Collection<String> subscriptions) {
        final long to = (timeoutMs == null || timeoutMs <= 0) ? DEFAULT_TIMEOUT_MS : timeoutMs;
        final SseEmitter emitter = new SseEmitter(to);
        final String id = UUID.randomUUID().toString();

        Set<String> exact = new LinkedHashSet<>();
        Set<String> prefixes = new LinkedHashSet<>();
        if (subscriptions != null) {
            for (String s : subscriptions) {
                if (!StringUtils.hasText(s)) continue;
                s = s.trim();
                if (s.endsWith(".*")) {
                    prefixes.add(s.substring(0, s.length() - 1));
                } else {
                    exact.add(s);
                }
            }
        }
        emitters.put(id, emitter);
        emitterTopics.put(id, exact);
        emitterPrefixes.put(id, prefixes);

        emitter.onCompletion(() -> removeEmitter(id));
        emitter.onTimeout(() -> removeEmitter(id));
        emitter.onError(e -> removeEmitter(id));

        try {
            emitter.send(SseEmitter.event().name("init").data("ok"));
        } catch (IOException ex) {
            log.debug("SSE init failed for {}", id, ex);
            removeEmitter(id);
        }

        startHeartbeatIfNeeded();
        return emitter;
    }

    public SseEmitter subscribeCsv(@Nullable Long timeoutMs, @Nullable String csvTopics) {
        List<String> subs = new ArrayList<>();
        if (StringUtils.hasText(csvTopics)) {
            for (String s : csvTopics.split(",")) {
                if (StringUtils.hasText(s)) subs.add(s.trim());
            }
        }
        return subscribe(timeoutMs, subs);
    }

    public int subscriberCount() {
        return emitters.size();
    }

    private boolean matches(String emitterId, String topic) {
        Set<String> exact = emitterTopics.get(emitterId);
        if (exact != null && exact.contains(topic)) return true;
        Set<String> prefixes = emitterPrefixes.get(emitterId);
        if (prefixes == null) return false;
        for (String p : prefixes) {
            if (topic.startsWith(p)) return true;
        }
        return false;
    }

    private void removeEmitter(String id) {
        SseEmitter em = emitters.remove(id);
        emitterTopics.remove(id);
        emitterPrefixes.remove(id);
        if (em != null) {
            try {
                em.complete();
            } catch (IllegalStateException ex) {
                log.trace("Emitter {} already completed", id);
            }
        }
    }

    private void startHeartbeatIfNeeded() {
        if (taskScheduler == null) return;
        if (heartbeatScheduled.compareAndSet(false, true)) {
            taskScheduler.scheduleAtFixedRate(() -> {
                for (Map.Entry<String, SseEmitter> e : emitters.entrySet()) {
                    try {
                        e.getValue().send(SseEmitter.event().name("heartbeat").data("ping"));
                    } catch (IOException | IllegalStateException ex) {
                        removeEmitter(e.getKey());
                    }
                }
            }, HEARTBEAT_EVERY);
            log.info("SSE heartbeat every {}s", HEARTBEAT_EVERY.getSeconds());
        }
    }
}
