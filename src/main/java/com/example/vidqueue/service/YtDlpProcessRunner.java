package com.example.vidqueue.service;

import com.example.vidqueue.utils.constants.RegexPatterns;
import com.example.vidqueue.utils.model.ProgressEvent;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeUnit;
import java.util.regex.Matcher;

/**
 * Запускает yt-dlp и разбирает его построчный вывод в события.
 */
@Slf4j
@Component
public class YtDlpProcessRunner implements ProcessRunner {
    @Value("${yt-dlp.path}") private String ytDlpPath;

    public YtDlpProcessRunner() {
    }

    YtDlpProcessRunner(String ytDlpPath) {
        this.ytDlpPath = ytDlpPath;
    }

    @Override
    public RunningProcess start(List<String> args, Path workingDirectory, ProcessOutputListener listener)
            throws IOException {
        List<String> command = new ArrayList<>();
        command.add(ytDlpPath);
        command.addAll(args);

        ProcessBuilder processBuilder = new ProcessBuilder(command);
        if (workingDirectory != null) {
            processBuilder.directory(workingDirectory.toFile());
        }
        processBuilder.environment().put("PYTHONIOENCODING", "utf-8");

        log.debug("Starting yt-dlp: {}", String.join(" ", command));
        Process process = processBuilder.start();

        Thread outputReader = startReader(process.getInputStream(), listener, "yt-dlp-out-" + process.pid());
        Thread errorReader = startReader(process.getErrorStream(), listener, "yt-dlp-err-" + process.pid());
        return new YtDlpProcess(process, outputReader, errorReader);
    }

    static ProgressEvent parseProgressLine(String line) {
        Matcher matcher = RegexPatterns.PROGRESS_PATTERN.matcher(line);
        if (!matcher.find()) {
            return null;
        }
        return ProgressEvent.builder()
                .percent(Double.parseDouble(matcher.group(1)))
                .total(matcher.group(2) != null ? matcher.group(2).trim() : null)
                .currentSpeed(matcher.group(3) != null ? matcher.group(3).trim() : null)
                .eta(matcher.group(4) != null ? matcher.group(4).trim() : null)
                .build();
    }

    static void dispatchLine(String line, ProcessOutputListener listener) {
        listener.onOutput(line + "\n");

        String trimmed = line.trim();
        if (trimmed.isEmpty()) {
            return;
        }

        ProgressEvent progress = parseProgressLine(trimmed);
        if (progress != null) {
            listener.onProgress(progress);
            return;
        }

        Matcher matcher = RegexPatterns.EVENT_PATTERN.matcher(trimmed);
        if (matcher.find()) {
            listener.onEvent(matcher.group(1), matcher.group(2));
        }
    }

    private static Thread startReader(InputStream stream, ProcessOutputListener listener, String name) {
        Thread reader = new Thread(() -> {
            try (BufferedReader lines = new BufferedReader(new InputStreamReader(stream, StandardCharsets.UTF_8))) {
                String line;
                while ((line = lines.readLine()) != null) {
                    log.debug("yt-dlp: {}", line);
                    try {
                        dispatchLine(line, listener);
                    } catch (RuntimeException e) {
                        log.warn("Output listener failed on line '{}': {}", line, e.getMessage());
                    }
                }
            } catch (IOException e) {
                log.debug("yt-dlp stream closed: {}", e.getMessage());
            }
        }, name);
        reader.setDaemon(true);
        reader.start();
        return reader;
    }

    private static class YtDlpProcess implements RunningProcess {
        private final Process process;
        private final Thread outputReader;
        private final Thread errorReader;

        YtDlpProcess(Process process, Thread outputReader, Thread errorReader) {
            this.process = process;
            this.outputReader = outputReader;
            this.errorReader = errorReader;
        }

        @Override
        public int waitFor() throws InterruptedException {
            int exitCode = process.waitFor();
            outputReader.join();
            errorReader.join();
            return exitCode;
        }

        @Override
        public void cancel() {
            if (!process.isAlive()) {
                return;
            }
            // Дочерние процессы (ffmpeg) тоже останавливаем
            process.descendants().forEach(ProcessHandle::destroyForcibly);
            process.destroy();
            try {
                if (!process.waitFor(3, TimeUnit.SECONDS)) {
                    process.destroyForcibly();
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                process.destroyForcibly();
            }
        }

        @Override
        public boolean isAlive() {
            return process.isAlive();
        }
    }
}
