package com.example.vidqueue.service;

import com.example.vidqueue.config.ApplicationConfig;
import com.example.vidqueue.utils.model.HistoryItem;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * История загрузок в JSON-файле. Запись на диск отложенная, память всегда актуальна.
 */
@Slf4j
@Service
public class JsonHistoryStore implements HistoryStore {
    private static final String HISTORY_FILE = "download_history.json";
    private static final Duration SAVE_DELAY = Duration.ofSeconds(1);

    private final Path historyPath;
    private final boolean clearOnStartup;
    private final Map<String, HistoryItem> downloadHistory = new LinkedHashMap<>();
    private final ObjectMapper objectMapper;
    private final CoalescingTimer saveTimer;

    @Autowired
    public JsonHistoryStore(ApplicationConfig appConfig, TaskScheduler taskScheduler) {
        this(Paths.get(appConfig.getDataDirectory(), HISTORY_FILE), taskScheduler, appConfig.isClearHistoryOnStartup());
    }

    JsonHistoryStore(Path historyPath, TaskScheduler taskScheduler, boolean clearOnStartup) {
        this.historyPath = historyPath;
        this.clearOnStartup = clearOnStartup;
        this.objectMapper = new ObjectMapper();
        this.objectMapper.registerModule(new JavaTimeModule());
        this.objectMapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        this.objectMapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        this.objectMapper.enable(SerializationFeature.INDENT_OUTPUT);
        this.saveTimer = new CoalescingTimer("history-save", taskScheduler, SAVE_DELAY, this::saveDownloadHistory);
    }

    @PostConstruct
    public void init() {
        loadDownloadHistory();
        if (clearOnStartup) {
            clear();
        }
    }

    public void loadDownloadHistory() {
        if (!Files.exists(historyPath)) {
            log.info("No download history file found at {}, starting with empty history", historyPath);
            return;
        }

        try {
            List<HistoryItem> loadedHistory = objectMapper.readValue(historyPath.toFile(), new TypeReference<>() {});
            synchronized (downloadHistory) {
                downloadHistory.clear();
                for (HistoryItem item : loadedHistory) {
                    if (item.getId() != null) {
                        downloadHistory.put(item.getId(), item);
                    }
                }
            }
            log.info("Loaded {} items from download history", loadedHistory.size());
        } catch (IOException e) {
            log.error("Error loading download history from {}. Starting with empty history.", historyPath, e);
            synchronized (downloadHistory) {
                downloadHistory.clear();
            }
        }
    }

    public void saveDownloadHistory() {
        List<HistoryItem> historyForSave;
        synchronized (downloadHistory) {
            historyForSave = downloadHistory.values().stream()
                    .map(HistoryItem::new)
                    .collect(Collectors.toList());
        }

        try {
            if (historyPath.getParent() != null) {
                Files.createDirectories(historyPath.getParent());
            }
            Files.writeString(historyPath, objectMapper.writeValueAsString(historyForSave));
            log.debug("Saved {} items to download history file {}", historyForSave.size(), historyPath);
        } catch (IOException e) {
            log.error("Error saving download history to file: {}", e.getMessage(), e);
        }
    }

    @PreDestroy
    public void flush() {
        saveTimer.flush();
    }

    @Override
    public void upsert(String id, HistoryItem fields) {
        synchronized (downloadHistory) {
            HistoryItem existing = downloadHistory.get(id);
            if (existing == null) {
                HistoryItem created = new HistoryItem(fields);
                created.setId(id);
                downloadHistory.put(id, created);
            } else {
                existing.merge(fields);
                existing.setId(id);
            }
        }
        saveTimer.schedule();
    }

    @Override
    public boolean remove(String id) {
        boolean removed;
        synchronized (downloadHistory) {
            removed = downloadHistory.remove(id) != null;
        }
        if (removed) {
            saveTimer.schedule();
        }
        return removed;
    }

    @Override
    public int removeMany(Collection<String> ids) {
        int removed = 0;
        synchronized (downloadHistory) {
            for (String id : ids) {
                if (downloadHistory.remove(id) != null) {
                    removed++;
                }
            }
        }
        if (removed > 0) {
            saveTimer.schedule();
        }
        return removed;
    }

    @Override
    public Optional<HistoryItem> getById(String id) {
        synchronized (downloadHistory) {
            HistoryItem item = downloadHistory.get(id);
            return item != null ? Optional.of(new HistoryItem(item)) : Optional.empty();
        }
    }

    @Override
    public List<HistoryItem> getAll() {
        List<HistoryItem> items;
        synchronized (downloadHistory) {
            items = downloadHistory.values().stream().map(HistoryItem::new).collect(Collectors.toList());
        }
        // Новые выше старых
        items.sort(Comparator.comparing(JsonHistoryStore::sortTime, Comparator.nullsLast(Comparator.reverseOrder())));
        return items;
    }

    @Override
    public void clear() {
        synchronized (downloadHistory) {
            downloadHistory.clear();
        }
        saveTimer.flush();
        log.info("Download history cleared");
    }

    private static Long sortTime(HistoryItem item) {
        return item.getCompletedAt() != null ? item.getCompletedAt() : item.getDownloadedAt();
    }
}
