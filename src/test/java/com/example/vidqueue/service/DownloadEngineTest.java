package com.example.vidqueue.service;

import com.example.vidqueue.config.ApplicationConfig;
import com.example.vidqueue.utils.model.AdmissionResult;
import com.example.vidqueue.utils.model.DownloadItem;
import com.example.vidqueue.utils.model.DownloadProgress;
import com.example.vidqueue.utils.model.DownloadRequest;
import com.example.vidqueue.utils.model.DownloadSessionItem;
import com.example.vidqueue.utils.model.DownloadStatus;
import com.example.vidqueue.utils.model.HistoryItem;
import com.example.vidqueue.utils.model.MediaType;
import com.example.vidqueue.utils.model.PlaylistDownloadEntry;
import com.example.vidqueue.utils.model.PlaylistDownloadRequest;
import com.example.vidqueue.utils.model.PlaylistDownloadResult;
import com.example.vidqueue.utils.model.PlaylistEntry;
import com.example.vidqueue.utils.model.PlaylistInfo;
import com.example.vidqueue.utils.model.TransformOptions;
import com.example.vidqueue.utils.model.TransformResult;
import com.example.vidqueue.utils.model.VideoFormatInfo;
import com.example.vidqueue.utils.model.VideoInfo;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executor;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.BooleanSupplier;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.fail;

class DownloadEngineTest {

    @TempDir
    Path dir;

    private ApplicationConfig config;
    private ThreadPoolTaskScheduler scheduler;
    private ExecutorService workers;
    private DownloadQueue queue;
    private ProcessRegistry processRegistry;
    private DownloadSessionStore sessionStore;
    private JsonHistoryStore historyStore;
    private FakeInfoProvider infoProvider;
    private ScriptedRunner runner;
    private FakeTranscoder transcoder;
    private RecordingEvents events;
    private Path outputDir;

    @BeforeEach
    void setUp() {
        config = new ApplicationConfig();
        config.setDirectory(dir.resolve("downloads").toString());
        config.setDataDirectory(dir.resolve("data").toString());

        scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(2);
        scheduler.initialize();
        workers = Executors.newCachedThreadPool();

        queue = new DownloadQueue(1);
        processRegistry = new ProcessRegistry();
        sessionStore = new DownloadSessionStore(dir.resolve("data").resolve("download-session.json"));
        historyStore = new JsonHistoryStore(dir.resolve("data").resolve("download_history.json"), scheduler, false);
        historyStore.init();

        infoProvider = new FakeInfoProvider();
        runner = new ScriptedRunner();
        transcoder = new FakeTranscoder(dir.resolve("bin").resolve("ffmpeg"));
        events = new RecordingEvents();
        outputDir = dir.resolve("out");
    }

    @AfterEach
    void tearDown() {
        workers.shutdownNow();
        scheduler.shutdown();
    }

    private DownloadEngine engine(Executor downloadExecutor) {
        DownloadPathService pathService = new DownloadPathService(config);
        FormatSelectionService formatSelectionService = new FormatSelectionService();
        DownloadEngine engine = new DownloadEngine(
                queue,
                processRegistry,
                new SessionSnapshotter(queue, sessionStore, scheduler),
                historyStore,
                infoProvider,
                new YtDlpArgumentBuilder(formatSelectionService, pathService),
                runner,
                transcoder,
                formatSelectionService,
                pathService,
                new OutputResolver(pathService, config),
                config,
                downloadExecutor,
                Runnable::run,
                scheduler);
        engine.addListener(events);
        return engine;
    }

    private DownloadEngine directEngine() {
        return engine(Runnable::run);
    }

    private DownloadEngine asyncEngine() {
        return engine(workers);
    }

    private DownloadRequest videoRequest(String url) {
        return DownloadRequest.builder()
                .url(url)
                .type(MediaType.VIDEO)
                .customDownloadPath(outputDir.toString())
                .build();
    }

    private static void waitUntil(BooleanSupplier condition) throws InterruptedException {
        long deadline = System.currentTimeMillis() + 10_000;
        while (!condition.getAsBoolean()) {
            if (System.currentTimeMillis() > deadline) {
                fail("Condition not met in time");
            }
            Thread.sleep(20);
        }
    }

    @Test
    void mergedVideoDownloadCompletes() {
        runner.files.add("Clip via Vidqueue.mp4");
        runner.lines.addAll(List.of(
                "[info] abc: Downloading 1 format(s): 137+140",
                "[download] Destination: Clip via Vidqueue.f137.mp4",
                "[download]  50.0% of 10.00MiB at 1.00MiB/s ETA 00:05",
                "[download] 100% of 10.00MiB in 00:00:05 at 2.00MiB/s",
                "[download] Destination: Clip via Vidqueue.f140.m4a",
                "[download]   5.0% of 1.00MiB at 1.00MiB/s ETA 00:01",
                "[download] 100% of 1.00MiB in 00:00:01 at 1.00MiB/s",
                "[Merger] Merging formats into \"Clip via Vidqueue.mp4\""));
        DownloadEngine engine = directEngine();

        AdmissionResult admission = engine.startDownload("job-1", videoRequest("https://example.com/watch?v=abc"));

        assertThat(admission).isEqualTo(AdmissionResult.STARTED);
        assertThat(infoProvider.videoCalls).hasValue(1);
        assertThat(events.names).contains("started:job-1", "completed:job-1", "queued:job-1");
        assertThat(events.progress).containsExactly(25.0, 50.0, 52.5, 100.0);

        HistoryItem history = historyStore.getById("job-1").orElseThrow();
        assertThat(history.getStatus()).isEqualTo(DownloadStatus.COMPLETED);
        assertThat(history.getTitle()).isEqualTo("Clip");
        assertThat(history.getUploader()).isEqualTo("Band");
        assertThat(history.getSavedFileName()).isEqualTo("Clip via Vidqueue.mp4");
        assertThat(history.getFileSize()).isEqualTo(20L);
        assertThat(history.getDownloadPath()).isEqualTo(outputDir.toString());
        assertThat(history.getSelectedFormat().getFormat_id()).isEqualTo("137");
        assertThat(history.getCompletedAt()).isNotNull();
        assertThat(history.getYtDlpCommand()).startsWith("yt-dlp ").contains("--ffmpeg-location");
        assertThat(history.getYtDlpLog()).contains("Merging formats into").doesNotContain("50.0%");

        List<String> args = runner.invocations.get(0);
        assertThat(args.get(args.size() - 1)).isEqualTo("https://example.com/watch?v=abc");
        assertThat(args.get(args.indexOf("--ffmpeg-location") + 1)).isEqualTo(dir.resolve("bin").toString());

        assertThat(engine.getActiveDownloads()).isEmpty();
        assertThat(engine.getQueueStatus().getActive()).isZero();
    }

    @Test
    void nonZeroExitIsRecordedAsError() {
        runner.exitCode = 1;
        runner.lines.add("ERROR: [generic] Unsupported URL");
        DownloadEngine engine = directEngine();

        engine.startDownload("job-err", videoRequest("https://example.com/bad"));

        HistoryItem history = historyStore.getById("job-err").orElseThrow();
        assertThat(history.getStatus()).isEqualTo(DownloadStatus.ERROR);
        assertThat(history.getError()).isEqualTo("Download exited with code 1");
        assertThat(history.getYtDlpLog()).contains("Unsupported URL");
        assertThat(events.names).contains("error:job-err:Download exited with code 1");
        assertThat(events.names).doesNotContain("completed:job-err");
        assertThat(queue.contains("job-err")).isFalse();
    }

    @Test
    void missingFfmpegFailsBeforeSpawn() {
        transcoder.missing = true;
        DownloadEngine engine = directEngine();

        engine.startDownload("job-ff", videoRequest("https://example.com/v"));

        assertThat(runner.invocations).isEmpty();
        HistoryItem history = historyStore.getById("job-ff").orElseThrow();
        assertThat(history.getStatus()).isEqualTo(DownloadStatus.ERROR);
        assertThat(history.getError()).startsWith("ffmpeg not found");
    }

    @Test
    void spawnFailureIsRecordedAsError() {
        runner.startFailure = new IOException("Cannot run program \"yt-dlp\"");
        DownloadEngine engine = directEngine();

        engine.startDownload("job-spawn", videoRequest("https://example.com/v"));

        HistoryItem history = historyStore.getById("job-spawn").orElseThrow();
        assertThat(history.getStatus()).isEqualTo(DownloadStatus.ERROR);
        assertThat(history.getError()).contains("Cannot run program");
        assertThat(processRegistry.contains("job-spawn")).isFalse();
    }

    @Test
    void metadataFailureDoesNotStopDownload() {
        infoProvider.failVideo = true;
        DownloadEngine engine = directEngine();

        engine.startDownload("job-meta", videoRequest("https://example.com/v"));

        // Предзагрузка и повторная попытка в задаче
        assertThat(infoProvider.videoCalls).hasValue(2);
        assertThat(runner.invocations).hasSize(1);
        HistoryItem history = historyStore.getById("job-meta").orElseThrow();
        assertThat(history.getStatus()).isEqualTo(DownloadStatus.COMPLETED);
        assertThat(history.getTitle()).isEqualTo(DownloadEngine.PLACEHOLDER_TITLE);
    }

    @Test
    void watermarkReplacesOutput() {
        config.setShareWatermark(true);
        runner.files.add("Clip via Vidqueue.mp4");
        runner.lines.add("[download] Destination: Clip via Vidqueue.mp4");
        transcoder.result = new TransformResult(outputDir.resolve("Clip via Vidqueue.mkv"), 99L);
        DownloadEngine engine = directEngine();

        engine.startDownload("job-wm", videoRequest("https://example.com/v"));

        assertThat(transcoder.transformed).hasSize(1);
        assertThat(transcoder.options.get(0).getTitle()).isEqualTo("Clip");
        assertThat(transcoder.options.get(0).getAuthor()).isEqualTo("Band");
        HistoryItem history = historyStore.getById("job-wm").orElseThrow();
        assertThat(history.getStatus()).isEqualTo(DownloadStatus.COMPLETED);
        assertThat(history.getSavedFileName()).isEqualTo("Clip via Vidqueue.mkv");
        assertThat(history.getFileSize()).isEqualTo(99L);
    }

    @Test
    void watermarkFailureKeepsOriginal() {
        config.setShareWatermark(true);
        runner.files.add("Clip via Vidqueue.mp4");
        runner.lines.add("[download] Destination: Clip via Vidqueue.mp4");
        transcoder.failTransform = true;
        DownloadEngine engine = directEngine();

        engine.startDownload("job-wm-fail", videoRequest("https://example.com/v"));

        HistoryItem history = historyStore.getById("job-wm-fail").orElseThrow();
        assertThat(history.getStatus()).isEqualTo(DownloadStatus.COMPLETED);
        assertThat(history.getSavedFileName()).isEqualTo("Clip via Vidqueue.mp4");
        assertThat(history.getFileSize()).isEqualTo(20L);
    }

    @Test
    void audioDownloadIsNotWatermarked() {
        config.setShareWatermark(true);
        runner.files.add("Clip via Vidqueue.m4a");
        runner.lines.add("[download] Destination: Clip via Vidqueue.m4a");
        DownloadEngine engine = directEngine();

        engine.startDownload("job-audio", DownloadRequest.builder()
                .url("https://example.com/a")
                .type(MediaType.AUDIO)
                .customDownloadPath(outputDir.toString())
                .build());

        assertThat(transcoder.transformed).isEmpty();
        assertThat(historyStore.getById("job-audio").orElseThrow().getSavedFileName()).isEqualTo("Clip via Vidqueue.m4a");
    }

    @Test
    void cancellingActiveDownloadSuppressesFinalization() throws Exception {
        runner.blocking = true;
        DownloadEngine engine = asyncEngine();

        engine.startDownload("job-c", videoRequest("https://example.com/v"));
        assertThat(runner.started.await(10, TimeUnit.SECONDS)).isTrue();
        waitUntil(() -> processRegistry.contains("job-c"));

        assertThat(engine.cancelDownload("job-c")).isTrue();
        waitUntil(() -> !processRegistry.contains("job-c"));

        assertThat(events.names).contains("cancelled:job-c");
        assertThat(events.names).doesNotContain("completed:job-c", "error:job-c:Download exited with code 143");
        assertThat(historyStore.getById("job-c")).isEmpty();
        assertThat(engine.getDownload("job-c")).isEmpty();
        assertThat(engine.cancelDownload("job-c")).isFalse();
    }

    @Test
    void cancellingQueuedDownloadNeverStartsIt() throws Exception {
        runner.blocking = true;
        DownloadEngine engine = asyncEngine();

        engine.startDownload("first", videoRequest("https://example.com/1"));
        assertThat(engine.startDownload("second", videoRequest("https://example.com/2"))).isEqualTo(AdmissionResult.QUEUED);
        assertThat(engine.getActiveDownloads()).extracting(DownloadItem::getId).containsExactlyInAnyOrder("first", "second");
        assertThat(engine.getDownload("second")).map(DownloadItem::getStatus).contains(DownloadStatus.PENDING);

        assertThat(engine.cancelDownload("second")).isTrue();
        assertThat(queue.contains("second")).isFalse();
        assertThat(historyStore.getById("second")).isEmpty();

        engine.cancelDownload("first");
        waitUntil(() -> !processRegistry.contains("first") && queue.getQueueStatus().getActive() == 0);
        assertThat(runner.invocations).hasSize(1);
    }

    @Test
    void cancellingDuringMetadataFetchLeavesNoHistory() throws Exception {
        infoProvider.failingCalls = 1;
        infoProvider.videoGate = new CountDownLatch(1);
        DownloadEngine engine = asyncEngine();

        engine.startDownload("job-m", videoRequest("https://example.com/v"));
        assertThat(infoProvider.videoEntered.await(10, TimeUnit.SECONDS)).isTrue();

        assertThat(engine.cancelDownload("job-m")).isTrue();
        assertThat(historyStore.getById("job-m")).isEmpty();

        infoProvider.videoGate.countDown();
        workers.shutdown();
        assertThat(workers.awaitTermination(10, TimeUnit.SECONDS)).isTrue();

        assertThat(historyStore.getById("job-m")).isEmpty();
        assertThat(runner.invocations).isEmpty();
        assertThat(events.names).containsOnly("queued:job-m", "cancelled:job-m");
    }

    @Test
    void duplicatesAreRejectedWithoutHistory() throws Exception {
        runner.blocking = true;
        DownloadEngine engine = asyncEngine();

        engine.startDownload("orig", videoRequest("https://example.com/v"));

        assertThat(engine.startDownload("copy", videoRequest("https://example.com/v"))).isEqualTo(AdmissionResult.DUPLICATE);
        assertThat(engine.startDownload("orig", videoRequest("https://example.com/other")))
                .isEqualTo(AdmissionResult.ALREADY_EXISTS);
        assertThat(historyStore.getById("copy")).isEmpty();
        assertThat(events.names).doesNotContain("queued:copy");

        engine.cancelDownload("orig");
        waitUntil(() -> !processRegistry.contains("orig"));
    }

    @Test
    void concurrencyChangeStartsQueuedJobs() throws Exception {
        runner.blocking = true;
        DownloadEngine engine = asyncEngine();
        engine.startDownload("a", videoRequest("https://example.com/1"));
        engine.startDownload("b", videoRequest("https://example.com/2"));

        engine.updateMaxConcurrent(2);

        waitUntil(() -> processRegistry.contains("a") && processRegistry.contains("b"));
        assertThat(engine.getQueueStatus().getActive()).isEqualTo(2);
        assertThat(engine.getQueueStatus().getMaxConcurrent()).isEqualTo(2);

        engine.cancelDownload("a");
        engine.cancelDownload("b");
        waitUntil(() -> !processRegistry.contains("a") && !processRegistry.contains("b"));
    }

    @Test
    void restoresUnfinishedSession() {
        DownloadRequest unfinished = videoRequest("https://example.com/resume");
        DownloadItem unfinishedItem = DownloadItem.builder()
                .id("resume")
                .url(unfinished.getUrl())
                .title("Half done")
                .type(MediaType.VIDEO)
                .status(DownloadStatus.DOWNLOADING)
                .progress(DownloadProgress.builder().percent(40.0).build())
                .createdAt(1_000L)
                .startedAt(2_000L)
                .build();
        DownloadRequest finished = videoRequest("https://example.com/done");
        DownloadItem finishedItem = DownloadItem.builder().id("done").url(finished.getUrl()).createdAt(500L).build();
        sessionStore.save(List.of(
                new DownloadSessionItem("resume", unfinished, unfinishedItem),
                new DownloadSessionItem("done", finished, finishedItem)));
        historyStore.upsert("done", HistoryItem.builder().status(DownloadStatus.COMPLETED).build());
        DownloadEngine engine = directEngine();

        engine.restoreActiveDownloads();
        engine.restoreActiveDownloads();

        assertThat(runner.invocations).hasSize(1);
        assertThat(runner.invocations.get(0)).last().isEqualTo("https://example.com/resume");
        HistoryItem restored = historyStore.getById("resume").orElseThrow();
        assertThat(restored.getStatus()).isEqualTo(DownloadStatus.COMPLETED);
        assertThat(events.names).contains("queued:resume", "completed:resume").doesNotContain("queued:done");
    }

    @Test
    void restoredJobsComeBackPending() throws Exception {
        runner.blocking = true;
        DownloadRequest first = videoRequest("https://example.com/first");
        DownloadItem firstItem = DownloadItem.builder().id("busy").url(first.getUrl()).createdAt(100L).build();
        DownloadRequest second = videoRequest("https://example.com/resume");
        DownloadItem secondItem = DownloadItem.builder()
                .id("resume")
                .url(second.getUrl())
                .title("Half done")
                .status(DownloadStatus.DOWNLOADING)
                .progress(DownloadProgress.builder().percent(65.0).currentSpeed("1.00MiB/s").build())
                .speed("1.00MiB/s")
                .createdAt(200L)
                .startedAt(300L)
                .completedAt(400L)
                .error("stale")
                .build();
        sessionStore.save(List.of(
                new DownloadSessionItem("busy", first, firstItem),
                new DownloadSessionItem("resume", second, secondItem)));
        DownloadEngine engine = asyncEngine();

        engine.restoreActiveDownloads();
        waitUntil(() -> processRegistry.contains("busy"));

        DownloadItem restored = engine.getDownload("resume").orElseThrow();
        assertThat(restored.getStatus()).isEqualTo(DownloadStatus.PENDING);
        assertThat(restored.getProgress().getPercent()).isZero();
        assertThat(restored.getStartedAt()).isNull();
        assertThat(restored.getCompletedAt()).isNull();
        assertThat(restored.getError()).isNull();
        assertThat(restored.getCreatedAt()).isEqualTo(200L);
        assertThat(restored.getTitle()).isEqualTo("Half done");
        assertThat(historyStore.getById("resume")).map(HistoryItem::getStatus).contains(DownloadStatus.PENDING);

        engine.cancelDownload("resume");
        engine.cancelDownload("busy");
        waitUntil(() -> !processRegistry.contains("busy"));
    }

    @Test
    void shutdownKeepsRunningJobsForNextStart() throws Exception {
        runner.blocking = true;
        DownloadEngine engine = asyncEngine();
        engine.startDownload("running", videoRequest("https://example.com/1"));
        engine.startDownload("waiting", videoRequest("https://example.com/2"));
        waitUntil(() -> processRegistry.contains("running"));

        engine.shutdown();
        waitUntil(() -> !processRegistry.contains("running"));

        assertThat(sessionStore.load()).extracting(DownloadSessionItem::getId).containsExactly("running", "waiting");
        assertThat(historyStore.getById("running")).map(HistoryItem::getStatus).contains(DownloadStatus.DOWNLOADING);
        assertThat(events.names).noneMatch(name -> name.startsWith("error:"));
        assertThat(runner.invocations).hasSize(1);
    }

    @Test
    void playlistWithDuplicateTitlesGetsNumberedNames() throws Exception {
        infoProvider.playlist = PlaylistInfo.builder()
                .id("PL1")
                .title("Road Trip")
                .entries(List.of(
                        PlaylistEntry.builder().id("e1").title("Intro").url("https://example.com/1").index(1).build(),
                        PlaylistEntry.builder().id("e2").title("Same").url("https://example.com/2").index(2).build(),
                        PlaylistEntry.builder().id("e3").title("Same").url("https://example.com/3").index(3).build()))
                .entryCount(3)
                .build();
        DownloadEngine engine = directEngine();

        PlaylistDownloadResult result = engine.startPlaylistDownload(PlaylistDownloadRequest.builder()
                .url("https://www.youtube.com/playlist?list=PL1")
                .type(MediaType.AUDIO)
                .format("251")
                .startIndex(3)
                .endIndex(2)
                .build());

        assertThat(result.getTotalCount()).isEqualTo(2);
        assertThat(result.getStartIndex()).isEqualTo(2);
        assertThat(result.getEndIndex()).isEqualTo(3);
        assertThat(result.getPlaylistTitle()).isEqualTo("Road Trip");
        assertThat(result.getEntries()).extracting(PlaylistDownloadEntry::getEntryId).containsExactly("e2", "e3");
        assertThat(result.getEntries()).allSatisfy(entry ->
                assertThat(entry.getDownloadId()).startsWith(result.getGroupId() + "_"));
        assertThat(result.getGroupId()).startsWith("playlist_group_");

        assertThat(runner.invocations).hasSize(2);
        List<String> firstArgs = runner.invocations.get(0);
        String output = firstArgs.get(firstArgs.indexOf("-o") + 1);
        assertThat(output).startsWith(Path.of(config.getDirectory(), "Playlists", "Road Trip").toString())
                .endsWith("2 - %(title)s via Vidqueue.%(ext)s");
        assertThat(firstArgs.get(firstArgs.indexOf("-f") + 1)).isEqualTo("251");

        String firstId = result.getEntries().get(0).getDownloadId();
        HistoryItem history = historyStore.getById(firstId).orElseThrow();
        assertThat(history.getPlaylistId()).isEqualTo(result.getGroupId());
        assertThat(history.getPlaylistIndex()).isEqualTo(2);
        assertThat(history.getPlaylistSize()).isEqualTo(2);
    }

    @Test
    void emptyPlaylistQueuesNothing() throws Exception {
        infoProvider.playlist = PlaylistInfo.builder().id("PL0").title("Empty").entries(List.of()).build();
        DownloadEngine engine = directEngine();

        PlaylistDownloadResult result = engine.startPlaylistDownload(PlaylistDownloadRequest.builder()
                .url("https://example.com/list").type(MediaType.VIDEO).build());

        assertThat(result.getTotalCount()).isZero();
        assertThat(result.getEntries()).isEmpty();
        assertThat(runner.invocations).isEmpty();
    }

    @Test
    void failingListenerDoesNotBreakDownload() {
        DownloadEngine engine = directEngine();
        engine.addListener(new DownloadEventListener() {
            @Override
            public void onStarted(String id) {
                throw new IllegalStateException("listener bug");
            }
        });

        engine.startDownload("job-l", videoRequest("https://example.com/v"));

        assertThat(historyStore.getById("job-l").orElseThrow().getStatus()).isEqualTo(DownloadStatus.COMPLETED);
    }

    static class RecordingEvents implements DownloadEventListener {
        final List<String> names = new CopyOnWriteArrayList<>();
        final List<Double> progress = new CopyOnWriteArrayList<>();

        @Override
        public void onQueued(DownloadItem item) {
            names.add("queued:" + item.getId());
        }

        @Override
        public void onStarted(String id) {
            names.add("started:" + id);
        }

        @Override
        public void onProgress(String id, DownloadProgress value) {
            progress.add(value.getPercent());
        }

        @Override
        public void onCompleted(String id) {
            names.add("completed:" + id);
        }

        @Override
        public void onError(String id, String message) {
            names.add("error:" + id + ":" + message);
        }

        @Override
        public void onCancelled(String id) {
            names.add("cancelled:" + id);
        }
    }

    static class FakeInfoProvider implements InfoProvider {
        final AtomicInteger videoCalls = new AtomicInteger();
        final CountDownLatch videoEntered = new CountDownLatch(1);
        volatile boolean failVideo;
        // Столько первых вызовов завершаются ошибкой
        volatile int failingCalls;
        volatile CountDownLatch videoGate;
        volatile PlaylistInfo playlist;

        @Override
        public VideoInfo getVideoInfo(String url) throws IOException, InterruptedException {
            int call = videoCalls.incrementAndGet();
            if (failVideo || call <= failingCalls) {
                throw new IOException("metadata unavailable");
            }
            videoEntered.countDown();
            CountDownLatch gate = videoGate;
            if (gate != null && !gate.await(30, TimeUnit.SECONDS)) {
                throw new IOException("metadata timed out");
            }
            return VideoInfo.builder()
                    .id("abc")
                    .title("Clip")
                    .uploader("Band")
                    .duration(60.0)
                    .formats(List.of(
                            VideoFormatInfo.builder().format_id("137").ext("mp4").vcodec("avc1").acodec("none")
                                    .height(1080).tbr(4000.0).build(),
                            VideoFormatInfo.builder().format_id("140").ext("m4a").vcodec("none").acodec("mp4a")
                                    .abr(128.0).build()))
                    .build();
        }

        @Override
        public PlaylistInfo getPlaylistInfo(String url) {
            return playlist;
        }
    }

    static class FakeTranscoder implements Transcoder {
        private final Path location;
        final List<Path> transformed = new CopyOnWriteArrayList<>();
        final List<TransformOptions> options = new CopyOnWriteArrayList<>();
        volatile boolean missing;
        volatile boolean failTransform;
        volatile TransformResult result;

        FakeTranscoder(Path location) {
            this.location = location;
        }

        @Override
        public Path resolveLocation() throws IOException {
            if (missing) {
                throw new IOException("ffmpeg not found at: " + location);
            }
            return location;
        }

        @Override
        public Optional<TransformResult> transform(Path input, TransformOptions transformOptions) throws IOException {
            transformed.add(input);
            options.add(transformOptions);
            if (failTransform) {
                throw new IOException("ffmpeg exited with code 1");
            }
            return Optional.ofNullable(result);
        }
    }

    static class ScriptedRunner implements ProcessRunner {
        final List<String> lines = new ArrayList<>();
        final List<String> files = new ArrayList<>();
        final List<List<String>> invocations = new CopyOnWriteArrayList<>();
        final CountDownLatch started = new CountDownLatch(1);
        volatile int exitCode;
        volatile boolean blocking;
        volatile IOException startFailure;

        @Override
        public RunningProcess start(List<String> args, Path workingDirectory, ProcessOutputListener listener)
                throws IOException {
            if (startFailure != null) {
                throw startFailure;
            }
            invocations.add(List.copyOf(args));
            for (String file : files) {
                Files.write(workingDirectory.resolve(file), new byte[20]);
            }
            for (String line : lines) {
                YtDlpProcessRunner.dispatchLine(line, listener);
            }
            started.countDown();
            return new FakeProcess(exitCode, blocking);
        }
    }

    static class FakeProcess implements RunningProcess {
        private final int exitCode;
        private final boolean blocking;
        private final CountDownLatch stopped = new CountDownLatch(1);
        private volatile boolean cancelled;

        FakeProcess(int exitCode, boolean blocking) {
            this.exitCode = exitCode;
            this.blocking = blocking;
        }

        @Override
        public int waitFor() throws InterruptedException {
            if (blocking) {
                stopped.await(30, TimeUnit.SECONDS);
            }
            return cancelled ? 143 : exitCode;
        }

        @Override
        public void cancel() {
            cancelled = true;
            stopped.countDown();
        }

        @Override
        public boolean isAlive() {
            return blocking && stopped.getCount() > 0;
        }
    }
}
