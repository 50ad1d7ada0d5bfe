package com.example.vidqueue.service;

import com.example.vidqueue.utils.model.DownloadSessionItem;
import com.example.vidqueue.utils.model.QueueEntry;
import com.example.vidqueue.utils.model.QueueStatus;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Сохраняет активные и ожидающие загрузки в файл сессии не чаще раза в секунду.
 */
@Slf4j
@Component
public class SessionSnapshotter implements QueueListener {
    private static final Duration PERSIST_DELAY = Duration.ofSeconds(1);

    private final DownloadQueue queue;
    private final DownloadSessionStore sessionStore;
    private final CoalescingTimer persistTimer;
    private volatile boolean closed;

    public SessionSnapshotter(DownloadQueue queue, DownloadSessionStore sessionStore, TaskScheduler taskScheduler) {
        this.queue = queue;
        this.sessionStore = sessionStore;
        this.persistTimer = new CoalescingTimer("session-persist", taskScheduler, PERSIST_DELAY, this::persist);
        queue.addListener(this);
    }

    @Override
    public void onQueueUpdated(QueueStatus status) {
        schedulePersist();
    }

    @Override
    public void onRecordUpdated(String id) {
        schedulePersist();
    }

    public void schedulePersist() {
        persistTimer.schedule();
    }

    public void flush() {
        persistTimer.flush();
    }

    // Последняя запись перед остановкой, дальнейшие изменения очереди не сохраняются
    public void close() {
        persistTimer.close();
        closed = true;
    }

    public List<DownloadSessionItem> load() {
        return sessionStore.load();
    }

    synchronized void persist() {
        if (closed) {
            return;
        }
        List<DownloadSessionItem> items = new ArrayList<>();
        for (QueueEntry entry : queue.getActiveEntries()) {
            items.add(new DownloadSessionItem(entry.getId(), entry.getRequest(), entry.getItem()));
        }
        for (QueueEntry entry : queue.getQueuedEntries()) {
            items.add(new DownloadSessionItem(entry.getId(), entry.getRequest(), entry.getItem()));
        }
        sessionStore.save(items);
    }
}
