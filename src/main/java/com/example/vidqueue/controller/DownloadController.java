package com.example.vidqueue.controller;

import com.example.vidqueue.config.ApplicationConfig;
import com.example.vidqueue.service.DownloadEngine;
import com.example.vidqueue.service.HistoryStore;
import com.example.vidqueue.service.InfoProvider;
import com.example.vidqueue.utils.model.AdmissionResult;
import com.example.vidqueue.utils.model.DownloadItem;
import com.example.vidqueue.utils.model.DownloadRequest;
import com.example.vidqueue.utils.model.DownloadResponse;
import com.example.vidqueue.utils.model.HistoryItem;
import com.example.vidqueue.utils.model.PlaylistDownloadRequest;
import com.example.vidqueue.utils.model.PlaylistDownloadResult;
import com.example.vidqueue.utils.model.QueueStatus;
import com.example.vidqueue.utils.model.VideoInfo;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.io.IOException;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.UUID;

@Slf4j
@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
public class DownloadController {

    private final DownloadEngine downloadEngine;
    private final HistoryStore historyStore;
    private final InfoProvider infoProvider;
    private final ApplicationConfig appConfig;

    @PostMapping("/downloads")
    public ResponseEntity<DownloadResponse> startDownload(
            @RequestParam(required = false) String id,
            @Valid @RequestBody DownloadRequest request) {
        String downloadId = id != null && !id.isBlank() ? id.trim() : UUID.randomUUID().toString();
        log.info("Received download request {} for URL: {}", downloadId, request.getUrl());

        AdmissionResult admission = downloadEngine.startDownload(downloadId, request);
        if (!admission.isAccepted()) {
            String error = admission == AdmissionResult.ALREADY_EXISTS
                    ? "Download with this id is already queued"
                    : "Identical download is already queued";
            return ResponseEntity.status(HttpStatus.CONFLICT)
                    .body(new DownloadResponse(false, "Download rejected", downloadId, admission, error));
        }
        String message = admission == AdmissionResult.STARTED ? "Download started" : "Download queued";
        return ResponseEntity.ok(new DownloadResponse(true, message, downloadId, admission));
    }

    @PostMapping("/downloads/playlist")
    public ResponseEntity<PlaylistDownloadResult> startPlaylistDownload(
            @Valid @RequestBody PlaylistDownloadRequest request) throws IOException, InterruptedException {
        log.info("Received playlist download request for URL: {}", request.getUrl());
        return ResponseEntity.ok(downloadEngine.startPlaylistDownload(request));
    }

    @DeleteMapping("/downloads/{id}")
    public ResponseEntity<DownloadResponse> cancelDownload(@PathVariable String id) {
        if (!downloadEngine.cancelDownload(id)) {
            throw new NoSuchElementException("Download not found: " + id);
        }
        return ResponseEntity.ok(new DownloadResponse(true, "Download cancelled", id, null));
    }

    @GetMapping("/downloads")
    public List<DownloadItem> getActiveDownloads() {
        return downloadEngine.getActiveDownloads();
    }

    @GetMapping("/downloads/{id}")
    public DownloadItem getDownload(@PathVariable String id) {
        return downloadEngine.getDownload(id)
                .orElseThrow(() -> new NoSuchElementException("Download not found: " + id));
    }

    @GetMapping("/downloads/status")
    public QueueStatus getQueueStatus() {
        return downloadEngine.getQueueStatus();
    }

    @PutMapping("/downloads/concurrency")
    public QueueStatus updateConcurrency(@RequestParam int value) {
        if (value < 1) {
            throw new IllegalArgumentException("Concurrency must be at least 1");
        }
        appConfig.updateConfig("maxConcurrentDownloads", String.valueOf(value));
        downloadEngine.updateMaxConcurrent(value);
        return downloadEngine.getQueueStatus();
    }

    @GetMapping("/history")
    public List<HistoryItem> getHistory() {
        return historyStore.getAll();
    }

    @GetMapping("/history/{id}")
    public HistoryItem getHistoryEntry(@PathVariable String id) {
        return historyStore.getById(id)
                .orElseThrow(() -> new NoSuchElementException("History entry not found: " + id));
    }

    @DeleteMapping("/history/{id}")
    public ResponseEntity<Map<String, Object>> removeHistoryEntry(@PathVariable String id) {
        if (!historyStore.remove(id)) {
            throw new NoSuchElementException("History entry not found: " + id);
        }
        return ResponseEntity.ok(Map.of("removed", 1));
    }

    @PostMapping("/history/delete")
    public Map<String, Object> removeHistoryEntries(@RequestBody List<String> ids) {
        return Map.of("removed", historyStore.removeMany(ids));
    }

    @DeleteMapping("/history")
    public ResponseEntity<Void> clearHistory() {
        historyStore.clear();
        return ResponseEntity.noContent().build();
    }

    @GetMapping("/info")
    public VideoInfo getVideoInfo(@RequestParam String url) throws IOException, InterruptedException {
        if (url.isBlank()) {
            throw new IllegalArgumentException("URL is required");
        }
        return infoProvider.getVideoInfo(url.trim());
    }

    @GetMapping("/health")
    public ResponseEntity<String> healthCheck() {
        return ResponseEntity.ok("Service is running");
    }
}
