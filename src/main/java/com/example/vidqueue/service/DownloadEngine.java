package com.example.vidqueue.service;

import com.example.vidqueue.config.ApplicationConfig;
import com.example.vidqueue.utils.constants.RegexPatterns;
import com.example.vidqueue.utils.model.AdmissionResult;
import com.example.vidqueue.utils.model.DownloadItem;
import com.example.vidqueue.utils.model.DownloadOrigin;
import com.example.vidqueue.utils.model.DownloadProgress;
import com.example.vidqueue.utils.model.DownloadRequest;
import com.example.vidqueue.utils.model.DownloadSessionItem;
import com.example.vidqueue.utils.model.DownloadStatus;
import com.example.vidqueue.utils.model.HistoryItem;
import com.example.vidqueue.utils.model.MediaType;
import com.example.vidqueue.utils.model.OutputResolutionRequest;
import com.example.vidqueue.utils.model.PlaylistDownloadEntry;
import com.example.vidqueue.utils.model.PlaylistDownloadRequest;
import com.example.vidqueue.utils.model.PlaylistDownloadResult;
import com.example.vidqueue.utils.model.PlaylistEntry;
import com.example.vidqueue.utils.model.PlaylistInfo;
import com.example.vidqueue.utils.model.ProgressEvent;
import com.example.vidqueue.utils.model.QueueEntry;
import com.example.vidqueue.utils.model.QueueStatus;
import com.example.vidqueue.utils.model.ResolvedOutput;
import com.example.vidqueue.utils.model.TransformOptions;
import com.example.vidqueue.utils.model.TransformResult;
import com.example.vidqueue.utils.model.VideoFormatInfo;
import com.example.vidqueue.utils.model.VideoInfo;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;
import java.util.regex.Matcher;

/**
 * Движок загрузок: принимает задачи в очередь, запускает yt-dlp для активных,
 * ведёт запись о загрузке и историю до конечного состояния.
 */
@Slf4j
@Service
public class DownloadEngine implements QueueListener {
    static final String PLACEHOLDER_TITLE = "Downloading...";
    private static final Duration LOG_FLUSH_DELAY = Duration.ofMillis(500);

    private final DownloadQueue queue;
    private final ProcessRegistry processRegistry;
    private final SessionSnapshotter sessionSnapshotter;
    private final HistoryStore historyStore;
    private final InfoProvider infoProvider;
    private final ArgumentBuilder argumentBuilder;
    private final ProcessRunner processRunner;
    private final Transcoder transcoder;
    private final FormatSelectionService formatSelectionService;
    private final DownloadPathService pathService;
    private final OutputResolver outputResolver;
    private final ApplicationConfig appConfig;
    private final Executor downloadExecutor;
    private final Executor prefetchExecutor;
    private final TaskScheduler taskScheduler;

    private final List<DownloadEventListener> listeners = new CopyOnWriteArrayList<>();
    private final Map<String, CompletableFuture<VideoInfo>> prefetchTasks = new ConcurrentHashMap<>();
    private final Map<String, VideoInfo> prefetchedInfo = new ConcurrentHashMap<>();
    private final AtomicBoolean sessionRestored = new AtomicBoolean(false);
    // Проверка членства в очереди и запись истории выполняются под одной блокировкой с удалением при отмене
    private final Object historyLock = new Object();
    private volatile boolean shuttingDown;

    public DownloadEngine(DownloadQueue queue,
                          ProcessRegistry processRegistry,
                          SessionSnapshotter sessionSnapshotter,
                          HistoryStore historyStore,
                          InfoProvider infoProvider,
                          ArgumentBuilder argumentBuilder,
                          ProcessRunner processRunner,
                          Transcoder transcoder,
                          FormatSelectionService formatSelectionService,
                          DownloadPathService pathService,
                          OutputResolver outputResolver,
                          ApplicationConfig appConfig,
                          @Qualifier("downloadExecutor") Executor downloadExecutor,
                          @Qualifier("prefetchExecutor") Executor prefetchExecutor,
                          TaskScheduler taskScheduler) {
        this.queue = queue;
        this.processRegistry = processRegistry;
        this.sessionSnapshotter = sessionSnapshotter;
        this.historyStore = historyStore;
        this.infoProvider = infoProvider;
        this.argumentBuilder = argumentBuilder;
        this.processRunner = processRunner;
        this.transcoder = transcoder;
        this.formatSelectionService = formatSelectionService;
        this.pathService = pathService;
        this.outputResolver = outputResolver;
        this.appConfig = appConfig;
        this.downloadExecutor = downloadExecutor;
        this.prefetchExecutor = prefetchExecutor;
        this.taskScheduler = taskScheduler;
        queue.addListener(this);
    }

    public void addListener(DownloadEventListener listener) {
        listeners.add(listener);
    }

    public void removeListener(DownloadEventListener listener) {
        listeners.remove(listener);
    }

    // ---------------------------------------------------------------- приём задач

    public AdmissionResult startDownload(String id, DownloadRequest request) {
        AdmissionResult admission = queue.checkAdmission(id, request);
        if (!admission.isAccepted()) {
            log.warn("Download {} rejected: {}", id, admission);
            return admission;
        }

        long createdAt = System.currentTimeMillis();
        String targetDownloadPath = resolveTargetDownloadPath(request);
        String historyDownloadPath = pathService.resolveHistoryDownloadPath(
                targetDownloadPath, request.getCustomFilenameTemplate(), null);
        pathService.ensureDirectoryExists(targetDownloadPath);
        pathService.ensureDirectoryExists(historyDownloadPath);

        DownloadItem item = DownloadItem.builder()
                .id(id)
                .url(request.getUrl())
                .title(PLACEHOLDER_TITLE)
                .type(request.getType())
                .status(DownloadStatus.PENDING)
                .progress(DownloadProgress.empty())
                .createdAt(createdAt)
                .tags(request.getTags())
                .origin(request.getOrigin() != null ? request.getOrigin() : DownloadOrigin.MANUAL)
                .subscriptionId(request.getSubscriptionId())
                .build();

        HistoryItem historyEntry = HistoryItem.builder()
                .status(DownloadStatus.PENDING)
                .downloadedAt(createdAt)
                .downloadPath(historyDownloadPath)
                .build();

        return admit(request, item, historyEntry, true);
    }

    public PlaylistDownloadResult startPlaylistDownload(PlaylistDownloadRequest options)
            throws IOException, InterruptedException {
        PlaylistInfo playlistInfo = infoProvider.getPlaylistInfo(options.getUrl());
        String groupId = "playlist_group_" + System.currentTimeMillis() + "_" + randomSuffix(6);
        List<PlaylistEntry> allEntries = playlistInfo.getEntries() != null ? playlistInfo.getEntries() : List.of();

        int totalEntries = allEntries.size();
        if (totalEntries == 0) {
            log.warn("Playlist has no entries: {}", options.getUrl());
            return PlaylistDownloadResult.builder()
                    .groupId(groupId)
                    .playlistId(playlistInfo.getId())
                    .playlistTitle(playlistInfo.getTitle())
                    .type(options.getType())
                    .totalCount(0)
                    .startIndex(0)
                    .endIndex(0)
                    .entries(List.of())
                    .build();
        }

        // Диапазон 1-based, границы меняются местами, если перепутаны
        int requestedStart = Math.max((options.getStartIndex() != null ? options.getStartIndex() : 1) - 1, 0);
        int requestedEnd = options.getEndIndex() != null
                ? Math.min(options.getEndIndex() - 1, totalEntries - 1)
                : totalEntries - 1;
        int rangeStart = Math.min(requestedStart, requestedEnd);
        int rangeEnd = Math.max(requestedStart, requestedEnd);
        rangeStart = Math.max(0, Math.min(rangeStart, totalEntries - 1));
        rangeEnd = Math.max(0, Math.min(rangeEnd, totalEntries - 1));

        String resolvedDownloadPath = options.getCustomDownloadPath() != null
                && !options.getCustomDownloadPath().trim().isEmpty()
                ? options.getCustomDownloadPath().trim()
                : pathService.resolveAutoPlaylistDownloadPath(appConfig.getDirectory(), playlistInfo, options.getUrl());
        pathService.ensureDirectoryExists(resolvedDownloadPath);

        List<PlaylistEntry> selectedEntries = new ArrayList<>();
        for (PlaylistEntry entry : allEntries.subList(rangeStart, rangeEnd + 1)) {
            if (entry.getUrl() == null || entry.getUrl().isBlank()) {
                log.warn("Skipping playlist entry with missing URL: {}", entry.getId());
                continue;
            }
            selectedEntries.add(entry);
        }
        int selectionSize = selectedEntries.size();
        log.info("Starting playlist download: {} items from '{}'", selectionSize, playlistInfo.getTitle());

        Set<String> normalizedTitles = new HashSet<>();
        boolean hasDuplicateTitles = false;
        for (PlaylistEntry entry : selectedEntries) {
            String key = pathService.sanitizeTemplateValue(entry.getTitle() != null ? entry.getTitle() : "").toLowerCase();
            if (!normalizedTitles.add(key)) {
                hasDuplicateTitles = true;
                break;
            }
        }
        int indexWidth = hasDuplicateTitles
                ? String.valueOf(selectedEntries.stream().mapToInt(PlaylistEntry::getIndex).max().orElse(0)).length()
                : 0;

        List<PlaylistDownloadEntry> downloadEntries = new ArrayList<>();
        for (PlaylistEntry entry : selectedEntries) {
            String downloadId = groupId + "_" + randomSuffix(8);
            String filenameTemplate = hasDuplicateTitles
                    ? String.format("%0" + indexWidth + "d - %%(title)s via %s.%%(ext)s",
                    entry.getIndex(), appConfig.getBrandingMarker())
                    : null;

            DownloadRequest request = DownloadRequest.builder()
                    .url(entry.getUrl())
                    .type(options.getType())
                    .format(options.getFormat())
                    .audioFormat(options.getType() == MediaType.AUDIO ? options.getFormat() : null)
                    .customDownloadPath(resolvedDownloadPath)
                    .customFilenameTemplate(filenameTemplate)
                    .build();

            long createdAt = System.currentTimeMillis();
            DownloadItem item = DownloadItem.builder()
                    .id(downloadId)
                    .url(entry.getUrl())
                    .title(entry.getTitle())
                    .type(options.getType())
                    .status(DownloadStatus.PENDING)
                    .progress(DownloadProgress.empty())
                    .createdAt(createdAt)
                    .origin(DownloadOrigin.MANUAL)
                    .playlistId(groupId)
                    .playlistTitle(playlistInfo.getTitle())
                    .playlistIndex(entry.getIndex())
                    .playlistSize(selectionSize)
                    .build();

            HistoryItem historyEntry = HistoryItem.builder()
                    .title(entry.getTitle())
                    .status(DownloadStatus.PENDING)
                    .downloadedAt(createdAt)
                    .downloadPath(resolvedDownloadPath)
                    .playlistId(groupId)
                    .playlistTitle(playlistInfo.getTitle())
                    .playlistIndex(entry.getIndex())
                    .playlistSize(selectionSize)
                    .build();

            AdmissionResult admission = admit(request, item, historyEntry, false);
            if (!admission.isAccepted()) {
                continue;
            }
            downloadEntries.add(PlaylistDownloadEntry.builder()
                    .downloadId(downloadId)
                    .entryId(entry.getId())
                    .title(entry.getTitle())
                    .url(entry.getUrl())
                    .index(entry.getIndex())
                    .build());
        }

        return PlaylistDownloadResult.builder()
                .groupId(groupId)
                .playlistId(playlistInfo.getId())
                .playlistTitle(playlistInfo.getTitle())
                .type(options.getType())
                .totalCount(selectionSize)
                .startIndex(!selectedEntries.isEmpty() ? selectedEntries.get(0).getIndex() : rangeStart + 1)
                .endIndex(!selectedEntries.isEmpty()
                        ? selectedEntries.get(selectedEntries.size() - 1).getIndex()
                        : rangeEnd + 1)
                .entries(downloadEntries)
                .build();
    }

    /**
     * Строка истории и предзагрузка метаданных создаются до постановки в очередь:
     * активная задача может начаться и закончиться раньше, чем вернётся submit.
     */
    private AdmissionResult admit(DownloadRequest request, DownloadItem item, HistoryItem historyEntry,
                                  boolean prefetch) {
        String id = item.getId();
        AdmissionResult precheck = queue.checkAdmission(id, request);
        if (!precheck.isAccepted()) {
            log.warn("Download {} rejected: {}", id, precheck);
            return precheck;
        }

        upsertHistoryEntry(id, request, historyEntry);
        if (prefetch) {
            prefetchVideoInfo(id, request, item);
        }

        AdmissionResult admission = queue.submit(request, item);
        if (!admission.isAccepted()) {
            // Проиграли гонку с параллельной постановкой
            if (admission == AdmissionResult.DUPLICATE) {
                historyStore.remove(id);
            }
            clearPrefetch(id);
            return admission;
        }

        log.info("Download {} queued ({}): {}", id, admission, request.getUrl());
        DownloadItem queued = item.copy();
        emit(listener -> listener.onQueued(queued));
        return admission;
    }

    // ---------------------------------------------------------------- управление

    public boolean cancelDownload(String id) {
        Optional<QueueEntry> entry = queue.getEntry(id);
        boolean wasActive = entry.map(e -> e.getState() == QueueEntry.State.ACTIVE).orElse(false);
        log.info("Cancelling download {}", id);

        // Ожидающая задача отменяется сразу, активную завершит обработчик выхода процесса
        DownloadItem patch = wasActive
                ? DownloadItem.builder().status(DownloadStatus.CANCELLING).build()
                : DownloadItem.builder().status(DownloadStatus.CANCELLED).completedAt(System.currentTimeMillis()).build();
        queue.updateRecord(id, patch);

        boolean processStopped = processRegistry.cancel(id);
        boolean removed = queue.remove(id);
        if (!removed && !processStopped) {
            log.warn("Download {} not found for cancellation", id);
            return false;
        }

        synchronized (historyLock) {
            historyStore.remove(id);
        }
        clearPrefetch(id);
        emit(listener -> listener.onCancelled(id));
        log.info("Download {} cancelled", id);
        return true;
    }

    public void updateMaxConcurrent(int maxConcurrent) {
        queue.setConcurrency(maxConcurrent);
    }

    public QueueStatus getQueueStatus() {
        return queue.getQueueStatus();
    }

    public List<DownloadItem> getActiveDownloads() {
        Map<String, DownloadItem> items = new LinkedHashMap<>();
        for (QueueEntry entry : queue.getActiveEntries()) {
            items.putIfAbsent(entry.getId(), entry.getItem());
        }
        for (QueueEntry entry : queue.getQueuedEntries()) {
            items.putIfAbsent(entry.getId(), entry.getItem());
        }
        List<DownloadItem> result = new ArrayList<>(items.values());
        result.sort(Comparator.comparing(
                (DownloadItem item) -> item.getCreatedAt() != null ? item.getCreatedAt() : 0L).reversed());
        return result;
    }

    public Optional<DownloadItem> getDownload(String id) {
        return queue.getEntry(id).map(QueueEntry::getItem);
    }

    public void flushDownloadSession() {
        sessionSnapshotter.flush();
    }

    // ---------------------------------------------------------------- восстановление и остановка

    @EventListener(ApplicationReadyEvent.class)
    public void restoreActiveDownloads() {
        if (!sessionRestored.compareAndSet(false, true)) {
            return;
        }

        List<DownloadSessionItem> sessionItems = sessionSnapshotter.load();
        if (sessionItems.isEmpty()) {
            return;
        }

        int restored = 0;
        for (DownloadSessionItem entry : sessionItems) {
            DownloadRequest options = entry.getOptions();
            if (entry.getId() == null || options == null || entry.getItem() == null
                    || options.getUrl() == null || options.getUrl().isBlank() || options.getType() == null) {
                continue;
            }
            String id = entry.getId();
            if (queue.contains(id)) {
                continue;
            }
            Optional<HistoryItem> history = historyStore.getById(id);
            if (history.isPresent() && history.get().getStatus() != null && history.get().getStatus().isTerminal()) {
                continue;
            }

            long createdAt = entry.getItem().getCreatedAt() != null
                    ? entry.getItem().getCreatedAt()
                    : System.currentTimeMillis();
            DownloadItem item = entry.getItem().copy();
            item.setId(id);
            item.setUrl(options.getUrl());
            item.setType(options.getType());
            item.setStatus(DownloadStatus.PENDING);
            item.setProgress(DownloadProgress.empty());
            item.setSpeed(null);
            item.setCreatedAt(createdAt);
            item.setStartedAt(null);
            item.setCompletedAt(null);
            item.setError(null);

            HistoryItem historyEntry = HistoryItem.builder()
                    .title(item.getTitle())
                    .status(DownloadStatus.PENDING)
                    .downloadedAt(history.map(HistoryItem::getDownloadedAt).orElse(createdAt))
                    .playlistId(item.getPlaylistId())
                    .playlistTitle(item.getPlaylistTitle())
                    .playlistIndex(item.getPlaylistIndex())
                    .playlistSize(item.getPlaylistSize())
                    .build();

            if (admit(options, item, historyEntry, false).isAccepted()) {
                restored++;
            }
        }

        if (restored > 0) {
            log.info("Restored {} downloads from previous session", restored);
        }
        sessionSnapshotter.schedulePersist();
    }

    @PreDestroy
    public void shutdown() {
        shuttingDown = true;
        // Сначала снимок, потом остановка процессов: прерванные задачи восстановятся при запуске
        sessionSnapshotter.close();
        processRegistry.stopAll();
    }

    // ---------------------------------------------------------------- выполнение

    @Override
    public void onStart(QueueEntry entry) {
        if (shuttingDown) {
            log.info("Skipping start of download {} during shutdown", entry.getId());
            return;
        }
        try {
            downloadExecutor.execute(() -> executeDownload(entry));
        } catch (RejectedExecutionException e) {
            log.error("Download {} could not be scheduled", entry.getId(), e);
            DownloadJob job = new DownloadJob(entry);
            failJob(job, "Download could not be scheduled: " + e.getMessage());
            queue.completed(entry.getId());
        }
    }

    void executeDownload(QueueEntry entry) {
        DownloadJob job = new DownloadJob(entry);
        try {
            runJob(job);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            failJob(job, "Download interrupted");
        } catch (Exception e) {
            log.error("Unexpected error in download {}", job.id, e);
            failJob(job, e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName());
        } finally {
            job.logTimer.close();
            processRegistry.release(job.id);
            queue.completed(job.id);
        }
    }

    private void runJob(DownloadJob job) throws InterruptedException {
        String id = job.id;
        DownloadRequest request = job.request;
        log.info("Starting download {} for {}", id, request.getUrl());

        String defaultDownloadPath = appConfig.getDirectory();
        boolean explicitPath = request.getCustomDownloadPath() != null && !request.getCustomDownloadPath().trim().isEmpty();
        job.resolvedDownloadPath = explicitPath ? request.getCustomDownloadPath().trim() : defaultDownloadPath;

        VideoInfo info = awaitVideoInfo(id, request.getUrl());
        if (info != null) {
            applyVideoInfo(job, info);
        }
        int parts = ProgressEstimator.refineParts(ProgressEstimator.estimateParts(request), request, job.selectedFormat);
        job.blender.setTotalParts(parts);
        log.debug("Download {} expects {} part(s)", id, parts);

        if (!explicitPath) {
            job.resolvedDownloadPath = pathService.resolveAutoVideoDownloadPath(defaultDownloadPath, info);
        }
        pathService.ensureDirectoryExists(job.resolvedDownloadPath);
        job.tracker = new OutputPathTracker(Paths.get(job.resolvedDownloadPath));

        // Отмена могла прийти, пока загружались метаданные
        if (job.isCancelled()) {
            log.info("Download {} cancelled before start", id);
            markCancelled(job);
            return;
        }

        String historyDownloadPath = pathService.resolveHistoryDownloadPath(
                job.resolvedDownloadPath, request.getCustomFilenameTemplate(), info);
        pathService.ensureDirectoryExists(historyDownloadPath);
        upsertJobHistory(id, request, HistoryItem.builder().downloadPath(historyDownloadPath).build());

        // Каталог назначения подставляется в рабочую копию запроса
        DownloadRequest effective = new DownloadRequest(request);
        effective.setCustomDownloadPath(job.resolvedDownloadPath);

        List<String> args = new ArrayList<>(argumentBuilder.buildArgs(
                effective, job.resolvedDownloadPath, appConfig, appConfig.getExtraArgs()));
        String urlArg = args.isEmpty() ? null : args.remove(args.size() - 1);
        if (urlArg == null || urlArg.isBlank()) {
            failJob(job, "Download arguments missing URL.");
            return;
        }

        Path ffmpegPath;
        try {
            ffmpegPath = transcoder.resolveLocation();
        } catch (IOException e) {
            failJob(job, e.getMessage());
            return;
        }
        Path ffmpegDir = ffmpegPath.getParent() != null ? ffmpegPath.getParent() : ffmpegPath;
        args.add("--ffmpeg-location");
        args.add(ffmpegDir.toString());
        args.add(urlArg);

        String command = argumentBuilder.formatCommand(args);
        updateDownloadInfo(job, DownloadItem.builder().ytDlpCommand(command).build());
        log.info("Download {} command: {}", id, command);

        String formatSelector = request.getType() == MediaType.VIDEO
                ? formatSelectionService.resolveVideoFormatSelector(request)
                : null;
        job.willMerge = formatSelector != null && formatSelector.contains("+");

        RunningProcess process;
        try {
            process = processRunner.start(args, Paths.get(job.resolvedDownloadPath), job);
        } catch (IOException e) {
            failJob(job, e.getMessage());
            return;
        }
        processRegistry.register(id, process);
        if (job.isCancelled()) {
            // Отмена пришла между проверкой и регистрацией процесса
            process.cancel();
        }

        updateDownloadInfo(job, DownloadItem.builder()
                .status(DownloadStatus.DOWNLOADING)
                .startedAt(System.currentTimeMillis())
                .build());
        emit(listener -> listener.onStarted(id));

        int exitCode = process.waitFor();
        job.flushLog();
        log.info("Download {} process exited with code {}", id, exitCode);

        if (job.isCancelled()) {
            markCancelled(job);
            return;
        }
        if (shuttingDown) {
            log.info("Download {} interrupted by shutdown, left for session restore", id);
            return;
        }
        if (exitCode != 0) {
            failJob(job, "Download exited with code " + exitCode);
            return;
        }
        completeJob(job);
    }

    private void completeJob(DownloadJob job) throws InterruptedException {
        String id = job.id;
        DownloadRequest request = job.request;
        VideoInfo info = job.videoInfo;
        DownloadItem snapshot = job.item.copy();

        String title = info != null && info.getTitle() != null ? info.getTitle() : "Unknown";
        String actualFormat = job.willMerge && job.tracker.getMergedExtension() != null
                ? job.tracker.getMergedExtension()
                : job.actualFormat;
        String extension = OutputResolver.resolveExtension(request.getType(), actualFormat, job.willMerge);
        Path directory = Paths.get(job.resolvedDownloadPath);
        Path fallbackPath = outputResolver.buildFallbackPath(directory, title, extension);

        ResolvedOutput output = outputResolver.resolve(OutputResolutionRequest.builder()
                .candidates(job.tracker.getCandidates())
                .lastKnownPath(job.tracker.getLastKnownPath())
                .fallbackPath(fallbackPath)
                .directory(directory)
                .title(info != null && info.getTitle() != null ? info.getTitle() : snapshot.getTitle())
                .extension(extension)
                .latestKnownSizeBytes(job.latestKnownSizeBytes)
                .build());
        log.info("Download {} output resolved to {} (located: {}, size: {})",
                id, output.getPath(), output.isLocated(), output.getSize());

        Path finalPath = output.getPath();
        Long finalSize = output.getSize();

        if (appConfig.isShareWatermark() && request.getType() == MediaType.VIDEO) {
            if (finalPath != null && Files.exists(finalPath)) {
                updateDownloadInfo(job, DownloadItem.builder().status(DownloadStatus.PROCESSING).build());
                try {
                    Optional<TransformResult> result = transcoder.transform(finalPath, TransformOptions.builder()
                            .title(info != null && info.getTitle() != null ? info.getTitle() : snapshot.getTitle())
                            .author(info != null && info.getUploader() != null ? info.getUploader() : snapshot.getUploader())
                            .build());
                    if (result.isPresent()) {
                        finalPath = result.get().getOutputPath();
                        finalSize = result.get().getFileSize();
                    }
                } catch (IOException e) {
                    log.warn("Watermark failed for download {}, keeping original file: {}", id, e.getMessage());
                }
            } else {
                log.warn("Watermark skipped for download {}: output file not found", id);
            }
        }

        if (job.isCancelled()) {
            markCancelled(job);
            return;
        }

        updateDownloadInfo(job, DownloadItem.builder()
                .status(DownloadStatus.COMPLETED)
                .completedAt(System.currentTimeMillis())
                .fileSize(finalSize)
                .savedFileName(finalPath != null && finalPath.getFileName() != null
                        ? finalPath.getFileName().toString()
                        : null)
                .build());
        recordHistory(job, DownloadStatus.COMPLETED, null);
        log.info("Download {} completed: {}", id, finalPath);
        emit(listener -> listener.onCompleted(id));
    }

    private void failJob(DownloadJob job, String message) {
        if (job.isCancelled()) {
            markCancelled(job);
            return;
        }
        if (shuttingDown) {
            log.info("Download {} stopped by shutdown: {}", job.id, message);
            return;
        }
        log.error("Download {} failed: {}", job.id, message);
        job.flushLog();
        updateDownloadInfo(job, DownloadItem.builder()
                .status(DownloadStatus.ERROR)
                .completedAt(System.currentTimeMillis())
                .error(message)
                .build());
        recordHistory(job, DownloadStatus.ERROR, message);
        emit(listener -> listener.onError(job.id, message));
    }

    private void markCancelled(DownloadJob job) {
        // Запись уже удалена из очереди, история не пишется
        job.item.merge(DownloadItem.builder()
                .status(DownloadStatus.CANCELLED)
                .completedAt(System.currentTimeMillis())
                .build());
        log.info("Download {} stopped after cancellation", job.id);
    }

    // ---------------------------------------------------------------- метаданные

    private void prefetchVideoInfo(String id, DownloadRequest request, DownloadItem item) {
        String url = request.getUrl() != null ? request.getUrl().trim() : "";
        if (url.isEmpty() || prefetchTasks.containsKey(id) || prefetchedInfo.containsKey(id)) {
            return;
        }

        CompletableFuture<VideoInfo> task = new CompletableFuture<>();
        prefetchTasks.put(id, task);
        try {
            prefetchExecutor.execute(() -> {
                VideoInfo info = null;
                try {
                    info = infoProvider.getVideoInfo(url);
                    prefetchedInfo.put(id, info);
                    updateDownloadInfo(id, request, item, buildInfoPatch(info));
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    log.warn("Metadata prefetch interrupted for download {}", id);
                } catch (IOException | RuntimeException e) {
                    log.warn("Failed to prefetch video info for download {}: {}", id, e.getMessage());
                } finally {
                    prefetchTasks.remove(id, task);
                    task.complete(info);
                }
            });
        } catch (RejectedExecutionException e) {
            log.warn("Metadata prefetch for download {} rejected: {}", id, e.getMessage());
            prefetchTasks.remove(id, task);
            task.complete(null);
        }
    }

    private VideoInfo awaitVideoInfo(String id, String url) throws InterruptedException {
        VideoInfo info = prefetchedInfo.remove(id);
        if (info != null) {
            return info;
        }

        CompletableFuture<VideoInfo> pending = prefetchTasks.get(id);
        if (pending != null) {
            try {
                info = pending.get();
            } catch (ExecutionException e) {
                log.debug("Prefetch task for download {} failed: {}", id, e.getMessage());
            }
            prefetchedInfo.remove(id);
            if (info != null) {
                return info;
            }
        }

        try {
            return infoProvider.getVideoInfo(url);
        } catch (IOException e) {
            log.warn("Failed to fetch video info for download {}, continuing with placeholders: {}", id, e.getMessage());
            return null;
        }
    }

    private void applyVideoInfo(DownloadJob job, VideoInfo info) {
        job.videoInfo = info;
        job.availableFormats = info.getFormats() != null ? info.getFormats() : List.of();
        job.selectedFormat = formatSelectionService.resolveSelectedFormat(
                job.availableFormats, job.request, appConfig.getOneClickQuality());
        if (job.selectedFormat != null) {
            job.actualFormat = job.selectedFormat.getExt();
        }

        DownloadItem patch = buildInfoPatch(info);
        patch.setSelectedFormat(job.selectedFormat);
        updateDownloadInfo(job, patch);
    }

    private void applySelectedFormat(DownloadJob job, String formatIds) {
        VideoFormatInfo candidate = formatSelectionService.findFormatByIdCandidates(job.availableFormats, formatIds);
        if (candidate == null || candidate.equals(job.selectedFormat)) {
            return;
        }
        job.selectedFormat = candidate;
        if (candidate.getExt() != null) {
            job.actualFormat = candidate.getExt();
        }
        updateDownloadInfo(job, DownloadItem.builder().selectedFormat(candidate).build());
    }

    private static DownloadItem buildInfoPatch(VideoInfo info) {
        return DownloadItem.builder()
                .title(info.getTitle())
                .thumbnail(info.getThumbnail())
                .duration(info.getDuration())
                .description(info.getDescription())
                .uploader(info.getUploader())
                .viewCount(info.getView_count())
                .build();
    }

    private void clearPrefetch(String id) {
        prefetchedInfo.remove(id);
        prefetchTasks.remove(id);
    }

    // ---------------------------------------------------------------- события процесса

    private void handleProgress(DownloadJob job, ProgressEvent event) {
        if (job.isCancelled()) {
            return;
        }
        Long totalBytes = FormatSelectionService.parseSizeToBytes(event.getTotal());
        if (totalBytes != null) {
            job.latestKnownSizeBytes = totalBytes;
        }
        Long downloadedBytes = FormatSelectionService.parseSizeToBytes(event.getDownloaded());
        if (downloadedBytes != null) {
            Long known = job.latestKnownSizeBytes;
            job.latestKnownSizeBytes = known != null ? Math.max(known, downloadedBytes) : downloadedBytes;
        }

        double blended = job.blender.update(event.getPercent());
        DownloadProgress progress = DownloadProgress.builder()
                .percent(blended)
                .currentSpeed(event.getCurrentSpeed())
                .eta(event.getEta())
                .downloaded(event.getDownloaded())
                .total(event.getTotal())
                .build();
        DownloadItem patch = DownloadItem.builder()
                .progress(progress)
                .speed(event.getCurrentSpeed() != null ? event.getCurrentSpeed() : "")
                .build();
        if (!queue.updateRecord(job.id, patch)) {
            job.item.merge(patch);
        }
        emit(listener -> listener.onProgress(job.id, progress));
    }

    private void handleEvent(DownloadJob job, String type, String data) {
        String lower = data.toLowerCase();
        if ("postprocess".equals(type) || "Merger".equals(type)
                || lower.contains("merging formats") || lower.contains("post-process")) {
            if (job.item.getStatus() != DownloadStatus.PROCESSING && !job.isCancelled()) {
                updateDownloadInfo(job, DownloadItem.builder().status(DownloadStatus.PROCESSING).build());
            }
        }

        if ("info".equals(type)) {
            Matcher matcher = RegexPatterns.INFO_FORMATS_PATTERN.matcher(data);
            if (matcher.find()) {
                applySelectedFormat(job, matcher.group(1));
            }
        } else if ("download".equals(type) && data.contains("format")) {
            Matcher matcher = RegexPatterns.DOWNLOAD_FORMAT_PATTERN.matcher(data);
            if (matcher.find()) {
                applySelectedFormat(job, matcher.group(1));
            }
        }
    }

    // ---------------------------------------------------------------- запись и история

    private void updateDownloadInfo(DownloadJob job, DownloadItem patch) {
        updateDownloadInfo(job.id, job.request, job.item, patch);
    }

    /**
     * Обновляет запись в очереди и переносит поля в историю. Если записи в очереди уже нет,
     * меняется только локальная копия: история удалённой задачи не воссоздаётся.
     */
    private void updateDownloadInfo(String id, DownloadRequest request, DownloadItem target, DownloadItem patch) {
        if (!queue.updateRecord(id, patch)) {
            if (target != null) {
                target.merge(patch);
            }
            return;
        }

        HistoryItem historyPatch = HistoryItem.fromRecordPatch(patch);
        if (!historyPatch.isEmpty()) {
            upsertJobHistory(id, request, historyPatch);
        }
        emit(listener -> listener.onUpdated(id, patch));
    }

    private void recordHistory(DownloadJob job, DownloadStatus status, String error) {
        DownloadItem snapshot = job.item.copy();
        upsertJobHistory(job.id, job.request, HistoryItem.builder()
                .title(snapshot.getTitle() != null ? snapshot.getTitle() : "Download " + job.id)
                .thumbnail(snapshot.getThumbnail())
                .status(status)
                .savedFileName(snapshot.getSavedFileName())
                .fileSize(snapshot.getFileSize())
                .duration(snapshot.getDuration())
                .completedAt(snapshot.getCompletedAt() != null ? snapshot.getCompletedAt() : System.currentTimeMillis())
                .error(error)
                .ytDlpCommand(snapshot.getYtDlpCommand())
                .ytDlpLog(snapshot.getYtDlpLog())
                .description(snapshot.getDescription())
                .uploader(snapshot.getUploader())
                .viewCount(snapshot.getViewCount())
                .tags(snapshot.getTags())
                .origin(snapshot.getOrigin())
                .subscriptionId(snapshot.getSubscriptionId())
                .selectedFormat(snapshot.getSelectedFormat())
                .playlistId(snapshot.getPlaylistId())
                .playlistTitle(snapshot.getPlaylistTitle())
                .playlistIndex(snapshot.getPlaylistIndex())
                .playlistSize(snapshot.getPlaylistSize())
                .build());
    }

    /**
     * Запись истории для задачи из очереди. Если задачу уже убрали из очереди, строка не пишется:
     * иначе она воскресила бы историю отменённой загрузки.
     */
    private void upsertJobHistory(String id, DownloadRequest request, HistoryItem updates) {
        synchronized (historyLock) {
            if (!queue.contains(id)) {
                log.debug("Download {} is no longer queued, history update skipped", id);
                return;
            }
            upsertHistoryEntry(id, request, updates);
        }
    }

    private void upsertHistoryEntry(String id, DownloadRequest request, HistoryItem updates) {
        try {
            if (historyStore.getById(id).isPresent()) {
                historyStore.upsert(id, updates);
                return;
            }
            HistoryItem base = HistoryItem.builder()
                    .id(id)
                    .url(request.getUrl())
                    .title("Download " + id)
                    .type(request.getType())
                    .status(DownloadStatus.PENDING)
                    .downloadPath(resolveTargetDownloadPath(request))
                    .downloadedAt(System.currentTimeMillis())
                    .tags(request.getTags())
                    .origin(request.getOrigin() != null ? request.getOrigin() : DownloadOrigin.MANUAL)
                    .subscriptionId(request.getSubscriptionId())
                    .build();
            base.merge(updates);
            historyStore.upsert(id, base);
        } catch (RuntimeException e) {
            log.error("Failed to update history for download {}", id, e);
        }
    }

    private String resolveTargetDownloadPath(DownloadRequest request) {
        String custom = request.getCustomDownloadPath();
        return custom != null && !custom.trim().isEmpty() ? custom.trim() : appConfig.getDirectory();
    }

    private void emit(Consumer<DownloadEventListener> event) {
        for (DownloadEventListener listener : listeners) {
            try {
                event.accept(listener);
            } catch (RuntimeException e) {
                log.warn("Download event listener failed: {}", e.getMessage(), e);
            }
        }
    }

    private static String randomSuffix(int length) {
        return UUID.randomUUID().toString().replace("-", "").substring(0, length);
    }

    /**
     * Состояние одной выполняемой загрузки. Получает вывод процесса как слушатель.
     */
    private final class DownloadJob implements ProcessOutputListener {
        private final String id;
        private final DownloadRequest request;
        private final DownloadItem item;
        private final ProgressBlender blender = new ProgressBlender(1);
        private final CoalescingTimer logTimer;
        private final StringBuilder logBuffer = new StringBuilder();
        private String lastFlushedLog = "";

        private volatile OutputPathTracker tracker;
        private volatile VideoInfo videoInfo;
        private volatile List<VideoFormatInfo> availableFormats = List.of();
        private volatile VideoFormatInfo selectedFormat;
        private volatile String actualFormat;
        private volatile Long latestKnownSizeBytes;
        private volatile String resolvedDownloadPath;
        private volatile boolean willMerge;

        DownloadJob(QueueEntry entry) {
            this.id = entry.getId();
            this.request = entry.getRequest();
            this.item = entry.getItem();
            this.logTimer = new CoalescingTimer("log-" + id, taskScheduler, LOG_FLUSH_DELAY, this::flushLog);
        }

        // Отменённая задача убирается из очереди, пока её процесс ещё завершается
        boolean isCancelled() {
            DownloadStatus status = item.getStatus();
            return status == DownloadStatus.CANCELLING || status == DownloadStatus.CANCELLED
                    || !queue.contains(id);
        }

        @Override
        public void onOutput(String chunk) {
            String normalized = chunk.replace("\r\n", "\n").replace('\r', '\n');
            OutputPathTracker currentTracker = tracker;
            StringBuilder appended = new StringBuilder();
            for (String line : normalized.split("\n")) {
                if (currentTracker != null) {
                    currentTracker.capture(line);
                }
                // Промежуточные строки прогресса в лог не пишем
                Matcher progress = RegexPatterns.PROGRESS_PATTERN.matcher(line);
                if (progress.find() && Double.parseDouble(progress.group(1)) < 100) {
                    continue;
                }
                appended.append(line).append('\n');
            }
            if (appended.length() == 0) {
                return;
            }
            synchronized (logBuffer) {
                logBuffer.append(appended);
            }
            logTimer.schedule();
        }

        @Override
        public void onProgress(ProgressEvent event) {
            handleProgress(this, event);
        }

        @Override
        public void onEvent(String type, String data) {
            handleEvent(this, type, data);
        }

        synchronized void flushLog() {
            String current;
            synchronized (logBuffer) {
                current = logBuffer.toString();
            }
            if (current.equals(lastFlushedLog)) {
                return;
            }
            lastFlushedLog = current;
            updateDownloadInfo(this, DownloadItem.builder().ytDlpLog(current).build());
            emit(listener -> listener.onLog(id, current));
        }
    }
}
