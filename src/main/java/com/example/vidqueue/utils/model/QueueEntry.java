package com.example.vidqueue.utils.model;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.Setter;

/**
 * Позиция в очереди. Набором (ожидание или активные) управляет только очередь.
 */
@Getter
@AllArgsConstructor
public class QueueEntry {
    public enum State { QUEUED, ACTIVE }

    private final String id;
    private final DownloadRequest request;
    private final DownloadItem item;
    @Setter
    private State state;

    public QueueEntry snapshot() {
        return new QueueEntry(id, new DownloadRequest(request), item.copy(), state);
    }
}
