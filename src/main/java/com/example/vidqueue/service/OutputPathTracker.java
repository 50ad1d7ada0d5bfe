package com.example.vidqueue.service;

import com.example.vidqueue.utils.constants.RegexPatterns;
import lombok.extern.slf4j.Slf4j;

import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Собирает из вывода yt-dlp пути, куда он пишет результат.
 */
@Slf4j
public class OutputPathTracker {
    private static final List<Pattern> OUTPUT_PATTERNS = List.of(
            RegexPatterns.DESTINATION_PATTERN,
            RegexPatterns.MERGER_PATTERN,
            RegexPatterns.MOVING_PATTERN
    );

    private final Path downloadDirectory;
    private final Set<Path> candidates = new LinkedHashSet<>();
    private Path lastKnownPath;
    private Path mergedPath;

    public OutputPathTracker(Path downloadDirectory) {
        this.downloadDirectory = downloadDirectory;
    }

    public synchronized void capture(String line) {
        if (line == null || line.isBlank()) {
            return;
        }
        for (Pattern pattern : OUTPUT_PATTERNS) {
            Matcher matcher = pattern.matcher(line.trim());
            if (!matcher.find()) {
                continue;
            }
            Path path = toPath(matcher.group(1));
            if (path == null) {
                continue;
            }
            lastKnownPath = path;
            candidates.add(path);
            if (pattern == RegexPatterns.MERGER_PATTERN) {
                mergedPath = path;
            }
        }
    }

    public synchronized List<Path> getCandidates() {
        return new ArrayList<>(candidates);
    }

    public synchronized Path getLastKnownPath() {
        return lastKnownPath;
    }

    // Расширение контейнера, в который yt-dlp склеил потоки
    public synchronized String getMergedExtension() {
        if (mergedPath == null) {
            return null;
        }
        String name = mergedPath.getFileName().toString();
        int dot = name.lastIndexOf('.');
        return dot > 0 && dot < name.length() - 1 ? name.substring(dot + 1).toLowerCase() : null;
    }

    private Path toPath(String raw) {
        String cleaned = raw.trim().replaceAll("^[\"']+|[\"']+$", "");
        if (cleaned.isEmpty()) {
            return null;
        }
        try {
            Path path = Paths.get(cleaned);
            return path.isAbsolute() ? path.normalize() : downloadDirectory.resolve(path).normalize();
        } catch (InvalidPathException e) {
            log.debug("Ignoring unparsable output path '{}': {}", cleaned, e.getMessage());
            return null;
        }
    }
}
