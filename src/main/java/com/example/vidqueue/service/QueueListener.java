package com.example.vidqueue.service;

import com.example.vidqueue.utils.model.QueueEntry;
import com.example.vidqueue.utils.model.QueueStatus;

/**
 * Вызывается очередью вне её блокировки, поэтому слушатель может обращаться к очереди.
 */
public interface QueueListener {
    default void onStart(QueueEntry entry) {
    }

    default void onQueueUpdated(QueueStatus status) {
    }

    default void onRecordUpdated(String id) {
    }
}
