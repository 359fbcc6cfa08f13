package com.bluxguard.core.event;

/**
 * 进程内事件标记接口
 */
public interface GuardEvent {
}
