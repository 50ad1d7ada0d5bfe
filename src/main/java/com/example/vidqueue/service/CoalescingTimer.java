package com.example.vidqueue.service;

import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.TaskScheduler;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.ScheduledFuture;

/**
 * Отложенное действие, которое планируется не более одного раза за интервал.
 * Повторные {@link #schedule()} до срабатывания ничего не добавляют.
 */
@Slf4j
public class CoalescingTimer {
    private final TaskScheduler scheduler;
    private final Duration delay;
    private final Runnable action;
    private final String name;

    private ScheduledFuture<?> pending;
    private boolean closed;

    public CoalescingTimer(String name, TaskScheduler scheduler, Duration delay, Runnable action) {
        this.name = name;
        this.scheduler = scheduler;
        this.delay = delay;
        this.action = action;
    }

    public synchronized void schedule() {
        if (pending != null || closed) {
            return;
        }
        pending = scheduler.schedule(this::fire, Instant.now().plus(delay));
    }

    public boolean isPending() {
        synchronized (this) {
            return pending != null;
        }
    }

    // Отменяет ожидание и выполняет действие сразу
    public void flush() {
        cancelPending();
        run();
    }

    public void cancel() {
        cancelPending();
    }

    // После close() таймер больше не планирует, но ожидавшее действие выполняется
    public void close() {
        synchronized (this) {
            closed = true;
        }
        flush();
    }

    private void fire() {
        synchronized (this) {
            pending = null;
        }
        run();
    }

    private synchronized void cancelPending() {
        if (pending != null) {
            pending.cancel(false);
            pending = null;
        }
    }

    private void run() {
        try {
            action.run();
        } catch (RuntimeException e) {
            log.warn("Timer '{}' action failed: {}", name, e.getMessage(), e);
        }
    }
}
