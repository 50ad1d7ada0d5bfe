package com.example.vidqueue.service;

import com.example.vidqueue.config.ApplicationConfig;
import com.example.vidqueue.utils.model.AdmissionResult;
import com.example.vidqueue.utils.model.DownloadItem;
import com.example.vidqueue.utils.model.DownloadRequest;
import com.example.vidqueue.utils.model.DownloadStatus;
import com.example.vidqueue.utils.model.QueueEntry;
import com.example.vidqueue.utils.model.QueueStatus;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.LinkedList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.stream.Collectors;

/**
 * Очередь загрузок с ограничением числа одновременно активных задач.
 * Продвижение строго FIFO по порядку постановки.
 */
@Slf4j
@Component
public class DownloadQueue {
    private final LinkedList<QueueEntry> queued = new LinkedList<>();
    private final Map<String, QueueEntry> active = new LinkedHashMap<>();
    private final List<QueueListener> listeners = new CopyOnWriteArrayList<>();
    private int maxConcurrent;

    @Autowired
    public DownloadQueue(ApplicationConfig appConfig) {
        this(appConfig.getMaxConcurrentDownloads());
    }

    public DownloadQueue(int maxConcurrent) {
        this.maxConcurrent = Math.max(1, maxConcurrent);
    }

    public void addListener(QueueListener listener) {
        listeners.add(listener);
    }

    public synchronized AdmissionResult checkAdmission(String id, DownloadRequest request) {
        if (findEntry(id) != null) {
            return AdmissionResult.ALREADY_EXISTS;
        }
        String signature = DownloadSignature.of(request);
        if (findBySignature(signature) != null) {
            return AdmissionResult.DUPLICATE;
        }
        return AdmissionResult.QUEUED;
    }

    public AdmissionResult submit(DownloadRequest request, DownloadItem item) {
        String id = item.getId();
        List<QueueEntry> started;
        AdmissionResult result;

        synchronized (this) {
            result = checkAdmission(id, request);
            if (!result.isAccepted()) {
                QueueEntry existing = result == AdmissionResult.ALREADY_EXISTS
                        ? findEntry(id)
                        : findBySignature(DownloadSignature.of(request));
                log.warn("Rejected download {} ({}), existing entry {}", id, result,
                        existing != null ? existing.getId() : "-");
                return result;
            }
            queued.addLast(new QueueEntry(id, request, item, QueueEntry.State.QUEUED));
            started = promote();
            result = active.containsKey(id) ? AdmissionResult.STARTED : AdmissionResult.QUEUED;
            log.info("Download {} admitted as {} ({} active, {} queued)", id, result, active.size(), queued.size());
        }

        fireStarted(started);
        fireQueueUpdated();
        return result;
    }

    public boolean remove(String id) {
        List<QueueEntry> started = Collections.emptyList();
        synchronized (this) {
            boolean removed = active.remove(id) != null;
            if (removed) {
                started = promote();
            } else {
                removed = queued.removeIf(entry -> entry.getId().equals(id));
            }
            if (!removed) {
                return false;
            }
            log.info("Download {} removed from queue", id);
        }

        fireStarted(started);
        fireQueueUpdated();
        return true;
    }

    public void completed(String id) {
        List<QueueEntry> started;
        synchronized (this) {
            if (active.remove(id) == null) {
                return;
            }
            started = promote();
        }

        fireStarted(started);
        fireQueueUpdated();
    }

    public void setConcurrency(int concurrency) {
        List<QueueEntry> started;
        synchronized (this) {
            this.maxConcurrent = Math.max(1, concurrency);
            started = promote();
            log.info("Max concurrent downloads set to {}", maxConcurrent);
        }

        fireStarted(started);
        fireQueueUpdated();
    }

    public boolean updateRecord(String id, DownloadItem patch) {
        synchronized (this) {
            QueueEntry entry = findEntry(id);
            if (entry == null) {
                return false;
            }
            entry.getItem().merge(patch);
        }

        for (QueueListener listener : listeners) {
            try {
                listener.onRecordUpdated(id);
            } catch (RuntimeException e) {
                log.warn("Queue listener failed on record update {}: {}", id, e.getMessage());
            }
        }
        return true;
    }

    public synchronized boolean contains(String id) {
        return findEntry(id) != null;
    }

    public synchronized Optional<QueueEntry> getEntry(String id) {
        QueueEntry entry = findEntry(id);
        return entry != null ? Optional.of(entry.snapshot()) : Optional.empty();
    }

    public synchronized List<QueueEntry> getActiveEntries() {
        return active.values().stream().map(QueueEntry::snapshot).collect(Collectors.toList());
    }

    public synchronized List<QueueEntry> getQueuedEntries() {
        return queued.stream().map(QueueEntry::snapshot).collect(Collectors.toList());
    }

    public synchronized int getMaxConcurrent() {
        return maxConcurrent;
    }

    public synchronized QueueStatus getQueueStatus() {
        Map<DownloadStatus, Long> counts = new EnumMap<>(DownloadStatus.class);
        for (QueueEntry entry : allEntries()) {
            DownloadStatus status = entry.getItem().getStatus();
            if (status != null) {
                counts.merge(status, 1L, Long::sum);
            }
        }
        return QueueStatus.builder()
                .queued(queued.size())
                .active(active.size())
                .maxConcurrent(maxConcurrent)
                .activeIds(new ArrayList<>(active.keySet()))
                .statusCounts(counts)
                .build();
    }

    // Вызывается под блокировкой
    private List<QueueEntry> promote() {
        List<QueueEntry> started = new ArrayList<>();
        Iterator<QueueEntry> iterator = queued.iterator();
        while (active.size() < maxConcurrent && iterator.hasNext()) {
            QueueEntry next = iterator.next();
            iterator.remove();
            next.setState(QueueEntry.State.ACTIVE);
            active.put(next.getId(), next);
            started.add(next);
        }
        return started;
    }

    private QueueEntry findEntry(String id) {
        QueueEntry entry = active.get(id);
        if (entry != null) {
            return entry;
        }
        for (QueueEntry candidate : queued) {
            if (candidate.getId().equals(id)) {
                return candidate;
            }
        }
        return null;
    }

    private QueueEntry findBySignature(String signature) {
        for (QueueEntry entry : allEntries()) {
            if (DownloadSignature.of(entry.getRequest()).equals(signature)) {
                return entry;
            }
        }
        return null;
    }

    private List<QueueEntry> allEntries() {
        List<QueueEntry> all = new ArrayList<>(active.values());
        all.addAll(queued);
        return all;
    }

    private void fireStarted(List<QueueEntry> started) {
        for (QueueEntry entry : started) {
            for (QueueListener listener : listeners) {
                try {
                    listener.onStart(entry);
                } catch (RuntimeException e) {
                    log.error("Queue listener failed to start download {}", entry.getId(), e);
                }
            }
        }
    }

    private void fireQueueUpdated() {
        QueueStatus status = getQueueStatus();
        for (QueueListener listener : listeners) {
            try {
                listener.onQueueUpdated(status);
            } catch (RuntimeException e) {
                log.warn("Queue listener failed on queue update: {}", e.getMessage());
            }
        }
    }
}
