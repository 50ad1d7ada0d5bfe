package com.example.vidqueue.service;

import com.example.vidqueue.config.ApplicationConfig;
import com.example.vidqueue.utils.model.PlaylistEntry;
import com.example.vidqueue.utils.model.PlaylistInfo;
import com.example.vidqueue.utils.model.VideoFormatInfo;
import com.example.vidqueue.utils.model.VideoInfo;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

/**
 * Метаданные видео и плейлистов через yt-dlp в режиме вывода JSON.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class YtDlpInfoProvider implements InfoProvider {
    private final YtDlpArgumentBuilder argumentBuilder;
    private final ApplicationConfig appConfig;

    @Value("${yt-dlp.path}") private String ytDlpPath;

    private final ObjectMapper objectMapper = new ObjectMapper()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    @Override
    public VideoInfo getVideoInfo(String url) throws IOException, InterruptedException {
        String output = runJsonCommand(argumentBuilder.buildVideoInfoArgs(url, appConfig), "Video info");

        VideoInfo videoInfo;
        try {
            videoInfo = objectMapper.readValue(output, VideoInfo.class);
        } catch (IOException e) {
            log.error("Failed to parse video info JSON for {}", url);
            throw new IOException("Failed to parse video info JSON: " + e.getMessage(), e);
        }
        fillApproximateSizes(videoInfo);

        log.info("Video info retrieved: '{}' (ID: {}), {} formats available",
                videoInfo.getTitle(), videoInfo.getId(),
                videoInfo.getFormats() != null ? videoInfo.getFormats().size() : 0);
        return videoInfo;
    }

    @Override
    public PlaylistInfo getPlaylistInfo(String url) throws IOException, InterruptedException {
        String output = runJsonCommand(argumentBuilder.buildPlaylistInfoArgs(url, appConfig), "Playlist info");

        JsonNode root;
        try {
            root = objectMapper.readTree(output);
        } catch (IOException e) {
            log.error("Failed to parse playlist info for {}", url);
            throw new IOException("Failed to parse playlist info: " + e.getMessage(), e);
        }

        List<PlaylistEntry> entries = new ArrayList<>();
        JsonNode rawEntries = root.path("entries");
        if (rawEntries.isArray()) {
            int index = 0;
            for (JsonNode entry : rawEntries) {
                index++;
                String entryUrl = resolveEntryUrl(entry);
                if (entryUrl.isEmpty()) {
                    continue;
                }
                entries.add(PlaylistEntry.builder()
                        .id(textOr(entry, "id", String.valueOf(index - 1)))
                        .title(textOr(entry, "title", "Entry " + index))
                        .url(entryUrl)
                        .index(index)
                        .build());
            }
        }

        log.info("Successfully retrieved playlist info for {}: {} entries", url, entries.size());
        return PlaylistInfo.builder()
                .id(textOr(root, "id", url))
                .title(textOr(root, "title", "Playlist"))
                .entries(entries)
                .entryCount(entries.size())
                .build();
    }

    // Размер по битрейту, если yt-dlp не сообщил его
    static void fillApproximateSizes(VideoInfo info) {
        if (info.getFormats() == null || info.getDuration() == null) {
            return;
        }
        for (VideoFormatInfo format : info.getFormats()) {
            if (format.getFilesize() == null && format.getFilesize_approx() == null && format.getTbr() != null) {
                format.setFilesize_approx(Math.round(format.getTbr() * 1000 / 8 * info.getDuration()));
            }
        }
    }

    static String resolveEntryUrl(JsonNode entry) {
        String url = entry.path("url").asText("");
        if (url.startsWith("http")) {
            return url;
        }
        String webpageUrl = entry.path("webpage_url").asText("");
        if (!webpageUrl.isEmpty()) {
            return webpageUrl;
        }
        String originalUrl = entry.path("original_url").asText("");
        if (!originalUrl.isEmpty()) {
            return originalUrl;
        }
        if (!url.isEmpty()) {
            String extractor = entry.path("ie_key").asText("").toLowerCase();
            if (extractor.contains("youtubemusic")) {
                return "https://music.youtube.com/watch?v=" + url;
            }
            if (extractor.contains("youtube")) {
                return "https://www.youtube.com/watch?v=" + url;
            }
        }
        return entry.path("id").asText("");
    }

    private String runJsonCommand(List<String> args, String operation) throws IOException, InterruptedException {
        List<String> command = new ArrayList<>();
        command.add(ytDlpPath);
        command.addAll(args);
        log.info("{} command: {}", operation, String.join(" ", command));

        Process process = new ProcessBuilder(command).start();

        // stderr читаем в отдельном потоке, чтобы процесс не встал на заполненном буфере
        StringBuilder errorOutput = new StringBuilder();
        Thread errorReader = new Thread(() -> {
            try (BufferedReader reader = new BufferedReader(
                    new InputStreamReader(process.getErrorStream(), StandardCharsets.UTF_8))) {
                String line;
                while ((line = reader.readLine()) != null) {
                    synchronized (errorOutput) {
                        errorOutput.append(line).append("\n");
                    }
                }
            } catch (IOException e) {
                log.debug("yt-dlp error stream closed: {}", e.getMessage());
            }
        });
        errorReader.start();

        StringBuilder output = new StringBuilder();
        try (BufferedReader reader = new BufferedReader(
                new InputStreamReader(process.getInputStream(), StandardCharsets.UTF_8))) {
            String line;
            while ((line = reader.readLine()) != null) {
                output.append(line);
            }
        }

        int exitCode = process.waitFor();
        errorReader.join();

        String stderr;
        synchronized (errorOutput) {
            stderr = errorOutput.toString().trim();
        }
        if (exitCode != 0) {
            log.error("{} command failed with exit code {}: {}", operation, exitCode, stderr);
            throw new IOException(!stderr.isEmpty() ? stderr : operation + " failed, exit code: " + exitCode);
        }
        if (output.length() == 0) {
            throw new IOException(operation + " command returned empty output");
        }
        return output.toString();
    }

    private static String textOr(JsonNode node, String field, String fallback) {
        String value = node.path(field).asText("");
        return value.isEmpty() ? fallback : value;
    }
}
