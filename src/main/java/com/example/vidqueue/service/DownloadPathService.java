package com.example.vidqueue.service;

import com.example.vidqueue.config.ApplicationConfig;
import com.example.vidqueue.utils.constants.RegexPatterns;
import com.example.vidqueue.utils.model.PlaylistInfo;
import com.example.vidqueue.utils.model.VideoInfo;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.text.Normalizer;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Каталоги загрузок, очистка имён и шаблонов.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class DownloadPathService {
    private static final Pattern TEMPLATE_TOKEN = Pattern.compile("%\\(([^)]+)\\)s");
    private static final Pattern CHANNEL_URL = Pattern.compile("youtube\\.com/(channel/|c/|user/|@)");
    private static final int MAX_TITLE_LENGTH = 50;

    private final ApplicationConfig appConfig;

    public String defaultFilenameTemplate() {
        return "%(title)s via " + appConfig.getBrandingMarker() + ".%(ext)s";
    }

    public void ensureDirectoryExists(String directory) {
        if (directory == null || directory.isBlank()) {
            return;
        }
        try {
            Files.createDirectories(Paths.get(directory));
        } catch (IOException e) {
            log.error("Failed to ensure download directory {}: {}", directory, e.getMessage());
        }
    }

    public String sanitizeFolderName(String value, String fallback) {
        String trimmed = value != null ? value.trim() : "";
        if (trimmed.isEmpty()) {
            return fallback;
        }
        String sanitized = trimmed
                .replaceAll("[\\\\/:*?\"<>|]+", "-")
                .replaceAll("\\s+", " ")
                .replaceAll("[. ]+$", "");
        return sanitized.isEmpty() ? fallback : sanitized;
    }

    public String sanitizeTemplateValue(String value) {
        return value
                .replaceAll("[\\\\/:*?\"<>|]+", "-")
                .replaceAll("\\s+", " ")
                .trim()
                .replaceAll("[. ]+$", "");
    }

    /**
     * Убирает из шаблона имени абсолютные пути, "." и "..", а также запрещённые символы.
     */
    public String sanitizeFilenameTemplate(String template) {
        String trimmed = template != null ? template.trim() : "";
        if (trimmed.isEmpty()) {
            return defaultFilenameTemplate();
        }
        List<String> safeParts = new ArrayList<>();
        for (String part : trimmed.replace('\\', '/').split("/")) {
            String cleaned = part.trim();
            if (cleaned.isEmpty() || ".".equals(cleaned) || "..".equals(cleaned)) {
                continue;
            }
            cleaned = cleaned.replaceAll("[<>:\"|?*]", "-").replaceAll("[. ]+$", "");
            if (!cleaned.isEmpty()) {
                safeParts.add(cleaned);
            }
        }
        return safeParts.isEmpty() ? defaultFilenameTemplate() : String.join("/", safeParts);
    }

    public boolean isLikelyChannelUrl(String url) {
        String normalized = url != null ? url.toLowerCase() : "";
        if (normalized.contains("list=")) {
            return false;
        }
        return CHANNEL_URL.matcher(normalized).find();
    }

    public String resolveAutoVideoDownloadPath(String basePath, VideoInfo info) {
        Path root = Paths.get(basePath, "Videos");
        if (info == null) {
            return root.toString();
        }
        String label = firstNonBlank(info.getUploader(), info.getTitle());
        if (label == null) {
            return root.toString();
        }
        return root.resolve(sanitizeFolderName(label, "Video")).toString();
    }

    public String resolveAutoPlaylistDownloadPath(String basePath, PlaylistInfo info, String url) {
        boolean channel = isLikelyChannelUrl(url);
        String kindFolder = channel ? "Channels" : "Playlists";
        String fallback = channel ? "Channel" : "Playlist";
        String title = info.getTitle() != null && !info.getTitle().isBlank() ? info.getTitle() : fallback;
        return Paths.get(basePath, kindFolder, sanitizeFolderName(title, fallback)).toString();
    }

    /**
     * Каталог, который задаёт шаблон имени. Если в пути каталога остались неразрешённые
     * токены, используется базовый каталог.
     */
    public String resolveHistoryDownloadPath(String basePath, String filenameTemplate, VideoInfo info) {
        if (filenameTemplate == null || filenameTemplate.isBlank()) {
            return basePath;
        }
        String safeTemplate = sanitizeFilenameTemplate(filenameTemplate);

        Matcher matcher = TEMPLATE_TOKEN.matcher(safeTemplate);
        StringBuilder resolved = new StringBuilder();
        while (matcher.find()) {
            String value = resolveTemplateToken(matcher.group(1), info);
            String replacement = value != null && !value.isEmpty() ? sanitizeTemplateValue(value) : matcher.group();
            matcher.appendReplacement(resolved, Matcher.quoteReplacement(replacement));
        }
        matcher.appendTail(resolved);

        String template = resolved.toString();
        int slash = template.lastIndexOf('/');
        if (slash <= 0) {
            return basePath;
        }
        String templateDir = template.substring(0, slash);
        if (TEMPLATE_TOKEN.matcher(templateDir).find()) {
            return basePath;
        }
        return Paths.get(basePath, templateDir.split("/")).toString();
    }

    // Имя файла по умолчанию, когда путь из лога неизвестен
    public String sanitizeTitleForFilename(String title) {
        String safe = title != null && !title.isBlank() ? title : "Unknown";
        safe = RegexPatterns.ILLEGAL_FILENAME_CHARS.matcher(safe).replaceAll("_");
        return safe.length() > MAX_TITLE_LENGTH ? safe.substring(0, MAX_TITLE_LENGTH) : safe;
    }

    /**
     * Ключ для нечёткого сравнения имени файла с названием: NFKC, нижний регистр,
     * без метки "via <бренд>" и без пунктуации.
     */
    public String buildFilenameKey(String value) {
        if (value == null || value.isEmpty()) {
            return "";
        }
        String normalized = Normalizer.normalize(value, Normalizer.Form.NFKC).toLowerCase();
        normalized = normalized.replaceAll(
                "via\\s*" + Pattern.quote(appConfig.getBrandingMarker().toLowerCase()), "");
        return RegexPatterns.FILENAME_KEY_STRIP.matcher(normalized).replaceAll("");
    }

    private String resolveTemplateToken(String token, VideoInfo info) {
        if (info == null) {
            return null;
        }
        return switch (token) {
            case "uploader", "channel" -> info.getUploader();
            case "title" -> info.getTitle();
            case "id" -> info.getId();
            case "extractor" -> info.getExtractor_key();
            default -> null;
        };
    }

    private static String firstNonBlank(String... values) {
        for (String value : values) {
            if (value != null && !value.trim().isEmpty()) {
                return value.trim();
            }
        }
        return null;
    }
}
