package com.example.vidqueue.service;

import com.example.vidqueue.utils.model.DownloadItem;
import com.example.vidqueue.utils.model.DownloadProgress;

/**
 * События жизненного цикла загрузки. Исключения слушателя логируются движком и не прерывают загрузку.
 */
public interface DownloadEventListener {
    default void onQueued(DownloadItem item) {
    }

    default void onStarted(String id) {
    }

    default void onProgress(String id, DownloadProgress progress) {
    }

    default void onLog(String id, String log) {
    }

    default void onUpdated(String id, DownloadItem patch) {
    }

    default void onCompleted(String id) {
    }

    default void onError(String id, String message) {
    }

    default void onCancelled(String id) {
    }
}
