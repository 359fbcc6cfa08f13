package com.bluxguard.core.event;

import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * 进程内同步事件总线
 */
@Slf4j
public class EventBus {

    private final Map<Class<? extends GuardEvent>, List<GuardEventListener<? extends GuardEvent>>> listeners =
            new ConcurrentHashMap<>();

    public <E extends GuardEvent> void subscribe(Class<E> eventType, GuardEventListener<E> listener) {
        listeners.computeIfAbsent(eventType, k -> new CopyOnWriteArrayList<>()).add(listener);
    }

    public <E extends GuardEvent> void unsubscribe(Class<E> eventType, GuardEventListener<E> listener) {
        List<GuardEventListener<? extends GuardEvent>> list = listeners.get(eventType);
        if (list != null && list.remove(listener)) {
            log.debug("Removed listener: {}", listener.getClass().getName());
        }
    }

    public <E extends GuardEvent> void publish(E event) {
        List<GuardEventListener<? extends GuardEvent>> registered = listeners.get(event.getClass());
        if (registered == null) return;
        for (GuardEventListener<? extends GuardEvent> listener : registered) {
            try {
                @SuppressWarnings("unchecked")
                GuardEventListener<E> castListener = (GuardEventListener<E>) listener;
                castListener.onEvent(event);
            } catch (RuntimeException e) {
                log.warn("Event listener threw exception, propagating: {}", e.getMessage());
                throw e; // Fail-Fast
            }
        }
    }
}
