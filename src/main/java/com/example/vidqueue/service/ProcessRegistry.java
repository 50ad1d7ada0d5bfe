package com.example.vidqueue.service;

import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Процессы запущенных загрузок. Существуют только в памяти и не сохраняются.
 */
@Slf4j
@Component
public class ProcessRegistry {
    private final Map<String, RunningProcess> activeProcesses = new ConcurrentHashMap<>();

    public void register(String id, RunningProcess process) {
        activeProcesses.put(id, process);
    }

    public void release(String id) {
        activeProcesses.remove(id);
    }

    public boolean contains(String id) {
        return activeProcesses.containsKey(id);
    }

    public boolean cancel(String id) {
        RunningProcess process = activeProcesses.get(id);
        if (process == null) {
            return false;
        }
        log.info("Stopping process of download {}", id);
        process.cancel();
        return true;
    }

    @PreDestroy
    public void stopAll() {
        List<String> ids = new ArrayList<>(activeProcesses.keySet());
        if (ids.isEmpty()) {
            return;
        }
        log.info("Stopping {} running download processes", ids.size());
        for (String id : ids) {
            try {
                cancel(id);
            } catch (RuntimeException e) {
                log.error("Error stopping process {}: {}", id, e.getMessage());
            }
        }
    }
}
