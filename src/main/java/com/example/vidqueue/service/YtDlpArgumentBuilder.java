package com.example.vidqueue.service;

import com.example.vidqueue.config.ApplicationConfig;
import com.example.vidqueue.utils.model.DownloadRequest;
import com.example.vidqueue.utils.model.MediaType;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.net.URI;
import java.net.URISyntaxException;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;

@Component
@RequiredArgsConstructor
public class YtDlpArgumentBuilder implements ArgumentBuilder {
    private static final List<String> YOUTUBE_HOSTS = List.of("youtube.com", "youtu.be", "youtube-nocookie.com");
    private static final String YOUTUBE_SAFE_PLAYER_CLIENTS = "default,-web,-web_safari";

    private final FormatSelectionService formatSelectionService;
    private final DownloadPathService pathService;

    @Override
    public List<String> buildArgs(DownloadRequest request, String downloadPath, ApplicationConfig settings,
                                  List<String> extraArgs) {
        List<String> args = new ArrayList<>(List.of("--no-playlist", "--no-mtime", "--newline", "--encoding", "utf-8"));

        if (request.getType() == MediaType.VIDEO) {
            String formatSelector = isBlank(request.getFormat()) && isBlank(request.getAudioFormat())
                    && !hasAudioIds(request) && isPreset(settings.getOneClickQuality())
                    ? formatSelectionService.buildVideoFormatPreference(settings.getOneClickQuality())
                    : formatSelectionService.resolveVideoFormatSelector(request);
            args.add("-f");
            args.add(formatSelector);
            if (hasAudioIds(request) || formatSelector.contains("mergeall")) {
                args.add("--audio-multistreams");
            }
        } else {
            String formatSelector = isBlank(request.getFormat()) && isPreset(settings.getOneClickQuality())
                    ? formatSelectionService.buildAudioFormatPreference(settings.getOneClickQuality())
                    : formatSelectionService.resolveAudioFormatSelector(request);
            args.add("-f");
            args.add(formatSelector);
        }

        if (!isBlank(request.getStartTime()) || !isBlank(request.getEndTime())) {
            String start = !isBlank(request.getStartTime()) ? request.getStartTime() : "0";
            String end = !isBlank(request.getEndTime()) ? request.getEndTime() : "";
            args.add("--download-sections");
            args.add("*" + start + "-" + end);
        }

        String browserForCookies = trim(settings.getBrowserForCookies());
        String cookiesPath = trim(settings.getCookiesPath());
        boolean hasSubtitleAuth = (!browserForCookies.isEmpty() && !"none".equals(browserForCookies))
                || !cookiesPath.isEmpty();
        // Субтитры bilibili без авторизации недоступны
        if (!isBilibiliUrl(request.getUrl()) || hasSubtitleAuth) {
            if (settings.isEmbedSubs()) {
                args.add("--sub-langs");
                args.add("all");
            } else {
                args.add("--write-subs");
            }
            args.add(settings.isEmbedSubs() ? "--embed-subs" : "--no-embed-subs");
        } else {
            args.add("--no-embed-subs");
        }
        args.add(settings.isEmbedThumbnail() ? "--embed-thumbnail" : "--no-embed-thumbnail");
        args.add(settings.isEmbedMetadata() ? "--embed-metadata" : "--no-embed-metadata");
        args.add(settings.isEmbedChapters() ? "--embed-chapters" : "--no-embed-chapters");

        String baseDownloadPath = !isBlank(request.getCustomDownloadPath())
                ? request.getCustomDownloadPath().trim()
                : !isBlank(settings.getDirectory()) ? settings.getDirectory().trim() : downloadPath;
        String template = request.getCustomFilenameTemplate() != null
                ? pathService.sanitizeFilenameTemplate(request.getCustomFilenameTemplate())
                : pathService.defaultFilenameTemplate();
        args.add("-o");
        args.add(Paths.get(baseDownloadPath, template.replaceFirst("^[\\\\/]+", "")).toString());
        args.add("--continue");
        args.add("--no-playlist-reverse");

        if (System.getProperty("os.name", "").toLowerCase().contains("win")) {
            args.add("--windows-filenames");
        }

        appendNetworkArgs(args, request.getUrl(), settings);

        if (extraArgs != null) {
            args.addAll(extraArgs);
        }
        args.add(request.getUrl());
        return args;
    }

    public List<String> buildVideoInfoArgs(String url, ApplicationConfig settings) {
        List<String> args = new ArrayList<>(List.of("-j", "--no-playlist", "--no-warnings", "--encoding", "utf-8"));
        appendNetworkArgs(args, url, settings);
        args.addAll(settings.getExtraArgs());
        args.add(url);
        return args;
    }

    public List<String> buildPlaylistInfoArgs(String url, ApplicationConfig settings) {
        List<String> args = new ArrayList<>(List.of("-J", "--flat-playlist", "--no-warnings", "--encoding", "utf-8"));
        appendNetworkArgs(args, url, settings);
        args.addAll(settings.getExtraArgs());
        args.add(url);
        return args;
    }

    private void appendNetworkArgs(List<String> args, String url, ApplicationConfig settings) {
        String browserForCookies = trim(settings.getBrowserForCookies());
        if (!browserForCookies.isEmpty() && !"none".equals(browserForCookies)) {
            args.add("--cookies-from-browser");
            args.add(browserForCookies);
        }
        String cookiesPath = trim(settings.getCookiesPath());
        if (!cookiesPath.isEmpty()) {
            args.add("--cookies");
            args.add(cookiesPath);
        }
        String proxy = trim(settings.getProxy());
        if (!proxy.isEmpty()) {
            args.add("--proxy");
            args.add(proxy);
        }
        String configPath = resolvePathWithHome(settings.getConfigPath());
        if (configPath != null) {
            args.add("--config-location");
            args.add(configPath);
        } else if (isYouTubeUrl(url)) {
            args.add("--extractor-args");
            args.add("youtube:player_client=" + YOUTUBE_SAFE_PLAYER_CLIENTS);
        }
    }

    static boolean isYouTubeUrl(String url) {
        String host = hostOf(url);
        if (host == null) {
            return false;
        }
        return YOUTUBE_HOSTS.stream().anyMatch(suffix -> host.equals(suffix) || host.endsWith("." + suffix));
    }

    private static boolean isBilibiliUrl(String url) {
        String host = hostOf(url);
        return host != null && (host.contains("bilibili.com") || host.contains("b23.tv") || host.contains("bili.tv"));
    }

    private static String hostOf(String url) {
        if (url == null) {
            return null;
        }
        try {
            String host = new URI(url.trim()).getHost();
            return host != null ? host.toLowerCase() : null;
        } catch (URISyntaxException e) {
            return null;
        }
    }

    private static String resolvePathWithHome(String rawPath) {
        String trimmed = trim(rawPath);
        if (trimmed.isEmpty()) {
            return null;
        }
        String home = System.getProperty("user.home");
        if ("~".equals(trimmed)) {
            return home;
        }
        if (trimmed.startsWith("~/") || trimmed.startsWith("~\\")) {
            return Paths.get(home, trimmed.substring(2)).toString();
        }
        return trimmed;
    }

    private static boolean isPreset(String quality) {
        return quality != null && !quality.isBlank() && !"auto".equalsIgnoreCase(quality.trim());
    }

    private static boolean hasAudioIds(DownloadRequest request) {
        return request.getAudioFormatIds() != null
                && request.getAudioFormatIds().stream().anyMatch(id -> id != null && !id.isBlank());
    }

    private static boolean isBlank(String value) {
        return value == null || value.trim().isEmpty();
    }

    private static String trim(String value) {
        return value != null ? value.trim() : "";
    }
}
