package com.example.vidqueue.service;

import com.example.vidqueue.config.ApplicationConfig;
import com.example.vidqueue.utils.model.DownloadSession;
import com.example.vidqueue.utils.model.DownloadSessionItem;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Файл снимка незавершённых загрузок. Ошибки чтения и записи только логируются.
 */
@Slf4j
@Component
public class DownloadSessionStore {
    private static final String SESSION_FILE = "download-session.json";

    private final Path sessionPath;
    private final ObjectMapper objectMapper;

    @Autowired
    public DownloadSessionStore(ApplicationConfig appConfig) {
        this(Paths.get(appConfig.getDataDirectory(), SESSION_FILE));
    }

    DownloadSessionStore(Path sessionPath) {
        this.sessionPath = sessionPath;
        this.objectMapper = new ObjectMapper();
        this.objectMapper.registerModule(new JavaTimeModule());
        this.objectMapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
    }

    public Path getSessionPath() {
        return sessionPath;
    }

    public List<DownloadSessionItem> load() {
        if (!Files.exists(sessionPath)) {
            return Collections.emptyList();
        }

        try {
            DownloadSession session = objectMapper.readValue(sessionPath.toFile(), DownloadSession.class);
            if (session == null || session.getVersion() != DownloadSession.VERSION || session.getItems() == null) {
                log.warn("Ignoring download session {} with unsupported layout", sessionPath);
                return Collections.emptyList();
            }
            return session.getItems().stream()
                    .filter(item -> item != null && item.getId() != null && item.getOptions() != null
                            && item.getItem() != null)
                    .collect(Collectors.toList());
        } catch (IOException e) {
            log.warn("Failed to load download session from {}: {}", sessionPath, e.getMessage());
            return Collections.emptyList();
        }
    }

    public synchronized void save(List<DownloadSessionItem> items) {
        if (items.isEmpty()) {
            try {
                Files.deleteIfExists(sessionPath);
            } catch (IOException e) {
                log.warn("Failed to clear download session {}: {}", sessionPath, e.getMessage());
            }
            return;
        }

        DownloadSession session = new DownloadSession(DownloadSession.VERSION, System.currentTimeMillis(), items);
        try {
            if (sessionPath.getParent() != null) {
                Files.createDirectories(sessionPath.getParent());
            }
            Files.writeString(sessionPath, objectMapper.writeValueAsString(session));
            log.debug("Saved {} items to download session", items.size());
        } catch (IOException e) {
            log.warn("Failed to save download session to {}: {}", sessionPath, e.getMessage());
        }
    }
}
