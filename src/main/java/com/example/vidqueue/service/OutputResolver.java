package com.example.vidqueue.service;

import com.example.vidqueue.config.ApplicationConfig;
import com.example.vidqueue.utils.model.MediaType;
import com.example.vidqueue.utils.model.OutputResolutionRequest;
import com.example.vidqueue.utils.model.ResolvedOutput;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Определяет итоговый файл загрузки по цепочке: пути из лога, запасное имя,
 * поиск по каталогу, последний известный размер.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class OutputResolver {
    private final DownloadPathService pathService;
    private final ApplicationConfig appConfig;

    public static String resolveExtension(MediaType type, String actualFormat, boolean willMerge) {
        if (actualFormat != null && !actualFormat.isBlank()) {
            return actualFormat.trim();
        }
        if (type == MediaType.AUDIO) {
            return "m4a";
        }
        return willMerge ? "mkv" : "mp4";
    }

    public Path buildFallbackPath(Path directory, String title, String extension) {
        return directory.resolve(pathService.sanitizeTitleForFilename(title) + "." + extension);
    }

    public ResolvedOutput resolve(OutputResolutionRequest request) {
        Path primary = request.getLastKnownPath() != null ? request.getLastKnownPath() : request.getFallbackPath();
        Long size = null;
        Path path = primary;
        boolean located = false;

        try {
            Optional<ResolvedOutput> observed = findObservedCandidate(request);
            if (observed.isEmpty()) {
                observed = scanDirectory(request);
            }
            if (observed.isPresent()) {
                path = observed.get().getPath();
                size = observed.get().getSize();
                located = true;
            }
        } catch (IOException | UncheckedIOException e) {
            log.warn("Failed to resolve file details in {}: {}", request.getDirectory(), e.getMessage());
        }

        if (size == null && request.getLatestKnownSizeBytes() != null) {
            size = request.getLatestKnownSizeBytes();
            if (!located) {
                log.warn("Output file not found, using estimated size {} for {}", size, primary);
            }
        } else if (size == null) {
            log.warn("Failed to find output file, expected {}", primary);
        }

        return new ResolvedOutput(path, size, located);
    }

    // Шаги 1-3: кандидаты из лога от последнего к первому, затем последний путь и запасное имя
    private Optional<ResolvedOutput> findObservedCandidate(OutputResolutionRequest request) throws IOException {
        List<Path> observed = request.getCandidates() != null
                ? new ArrayList<>(request.getCandidates())
                : new ArrayList<>();
        Collections.reverse(observed);

        Set<Path> ordered = new LinkedHashSet<>(observed);
        if (request.getLastKnownPath() != null) {
            ordered.add(request.getLastKnownPath());
        }
        if (request.getFallbackPath() != null) {
            ordered.add(request.getFallbackPath());
        }

        for (Path candidate : ordered) {
            if (Files.isRegularFile(candidate)) {
                log.debug("Output located from candidate {}", candidate);
                return Optional.of(new ResolvedOutput(candidate, Files.size(candidate), true));
            }
        }
        return Optional.empty();
    }

    // Шаг 4: поиск по каталогу, самый свежий файл из лучшей группы
    private Optional<ResolvedOutput> scanDirectory(OutputResolutionRequest request) throws IOException {
        Path directory = request.getDirectory();
        if (directory == null || !Files.isDirectory(directory)) {
            return Optional.empty();
        }

        List<Path> candidates;
        try (Stream<Path> files = Files.list(directory)) {
            candidates = files.filter(file -> extensionOf(file) != null).collect(Collectors.toList());
        }

        String extension = request.getExtension() != null ? request.getExtension().toLowerCase() : "";
        String titleKey = pathService.buildFilenameKey(request.getTitle());
        String marker = appConfig.getBrandingMarker().toLowerCase();

        List<Path> withExtension = candidates.stream()
                .filter(file -> extension.equals(extensionOf(file)))
                .collect(Collectors.toList());
        List<Path> titleMatches = withExtension.stream()
                .filter(file -> matchesTitle(titleKey, file))
                .collect(Collectors.toList());
        List<Path> brandedMatches = withExtension.stream()
                .filter(file -> file.getFileName().toString().toLowerCase().contains(marker))
                .collect(Collectors.toList());

        List<Path> pickFrom;
        if (!titleMatches.isEmpty()) {
            pickFrom = titleMatches;
        } else if (!brandedMatches.isEmpty()) {
            pickFrom = brandedMatches;
        } else {
            pickFrom = !withExtension.isEmpty() ? withExtension : candidates;
        }

        List<ResolvedOutput> existing = new ArrayList<>();
        List<Long> modified = new ArrayList<>();
        for (Path file : pickFrom) {
            BasicFileAttributes attributes = Files.readAttributes(file, BasicFileAttributes.class);
            if (!attributes.isRegularFile()) {
                continue;
            }
            existing.add(new ResolvedOutput(file, attributes.size(), true));
            modified.add(attributes.lastModifiedTime().toMillis());
        }
        if (existing.isEmpty()) {
            return Optional.empty();
        }

        int newest = 0;
        for (int i = 1; i < existing.size(); i++) {
            if (modified.get(i) > modified.get(newest)) {
                newest = i;
            }
        }
        ResolvedOutput found = existing.get(newest);
        log.info("Found actual file {} ({} bytes) by directory scan", found.getPath(), found.getSize());
        return Optional.of(found);
    }

    private boolean matchesTitle(String titleKey, Path file) {
        if (titleKey.isEmpty()) {
            return false;
        }
        String fileKey = pathService.buildFilenameKey(file.getFileName().toString());
        if (fileKey.isEmpty()) {
            return false;
        }
        return fileKey.contains(titleKey) || titleKey.contains(fileKey);
    }

    private static String extensionOf(Path file) {
        String name = file.getFileName().toString();
        int dot = name.lastIndexOf('.');
        if (dot < 0 || dot == name.length() - 1) {
            return null;
        }
        return name.substring(dot + 1).toLowerCase();
    }
}
