package com.example.vidqueue.service;

import com.example.vidqueue.utils.model.HistoryItem;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

public interface HistoryStore {
    /**
     * Создаёт строку или сливает ненулевые поля в существующую.
     */
    void upsert(String id, HistoryItem fields);

    boolean remove(String id);

    int removeMany(Collection<String> ids);

    Optional<HistoryItem> getById(String id);

    // Новые выше старых
    List<HistoryItem> getAll();

    void clear();
}
