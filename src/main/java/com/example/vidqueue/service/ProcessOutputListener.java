package com.example.vidqueue.service;

import com.example.vidqueue.utils.model.ProgressEvent;

public interface ProcessOutputListener {
    // Сырой фрагмент вывода, уже с переводом строки
    default void onOutput(String chunk) {
    }

    default void onProgress(ProgressEvent event) {
    }

    default void onEvent(String type, String data) {
    }
}
