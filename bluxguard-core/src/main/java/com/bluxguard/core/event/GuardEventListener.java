package com.bluxguard.core.event;

@FunctionalInterface
public interface GuardEventListener<E extends GuardEvent> {
    void onEvent(E event);
}
