package com.example.vidqueue.service;

import com.example.vidqueue.utils.constants.RegexPatterns;
import com.example.vidqueue.utils.model.DownloadRequest;
import com.example.vidqueue.utils.model.MediaType;
import com.example.vidqueue.utils.model.VideoFormatInfo;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.ToDoubleFunction;
import java.util.regex.Matcher;
import java.util.stream.Collectors;

/**
 * Выбор формата: селекторы yt-dlp для запроса и формат из списка метаданных для отображения.
 */
@Slf4j
@Service
public class FormatSelectionService {
    private static final Map<String, Integer> PRESET_HEIGHTS = Map.of(
            "good", 1080,
            "normal", 720,
            "bad", 480,
            "worst", 360
    );
    private static final Map<String, Integer> PRESET_AUDIO_ABR = Map.of(
            "best", 320,
            "good", 256,
            "normal", 192,
            "bad", 128,
            "worst", 96
    );

    public String resolveVideoFormatSelector(DownloadRequest request) {
        String format = request.getFormat();
        String audioFormat = request.getAudioFormat();
        List<String> audioFormatIds = nonBlank(request.getAudioFormatIds());

        if (format != null && !format.isEmpty() && "".equals(audioFormat)) {
            return format;
        }
        if (format != null && (format.contains("/") || format.contains("+") || format.contains("["))) {
            return format;
        }
        if (!audioFormatIds.isEmpty()) {
            String baseVideo = format != null && !format.isEmpty() && !"best".equals(format) ? format : "bestvideo*";
            return baseVideo + "+" + String.join("+", audioFormatIds);
        }
        if (format == null || format.isEmpty() || "best".equals(format)) {
            if ("none".equals(audioFormat)) {
                return "bestvideo+none";
            }
            if (audioFormat == null || audioFormat.isEmpty() || "best".equals(audioFormat)) {
                return "bestvideo+bestaudio/best";
            }
            return "bestvideo+" + audioFormat;
        }
        if ("none".equals(audioFormat)) {
            return format + "+none";
        }
        if (audioFormat == null || audioFormat.isEmpty() || "best".equals(audioFormat)) {
            return format + "+bestaudio/best";
        }
        return format + "+" + audioFormat;
    }

    public String resolveAudioFormatSelector(DownloadRequest request) {
        String format = request.getFormat();
        return format == null || format.isEmpty() ? "bestaudio" : format;
    }

    // Выражение формата для быстрой загрузки без явного выбора
    public String buildVideoFormatPreference(String preset) {
        String quality = normalizePreset(preset);
        if ("worst".equals(quality)) {
            return "worstvideo+worstaudio/worst/best";
        }
        Set<String> combinations = new LinkedHashSet<>();
        List<String> videoCandidates = new ArrayList<>();
        Integer maxHeight = PRESET_HEIGHTS.get(quality);
        if (maxHeight != null) {
            videoCandidates.add("bestvideo[height<=" + maxHeight + "]");
        }
        videoCandidates.add("bestvideo");
        for (String video : videoCandidates) {
            for (String audio : buildAudioSelectors(quality)) {
                combinations.add(video + "+" + audio);
            }
        }
        combinations.add("bestvideo+bestaudio");
        combinations.add("best");
        return String.join("/", combinations);
    }

    public String buildAudioFormatPreference(String preset) {
        Set<String> selectors = new LinkedHashSet<>(buildAudioSelectors(normalizePreset(preset)));
        selectors.add("best");
        return String.join("/", selectors);
    }

    /**
     * Формат, который будет показан в записи загрузки: сначала прямое совпадение с селектором,
     * затем подбор по пресету качества.
     */
    public VideoFormatInfo resolveSelectedFormat(List<VideoFormatInfo> formats, DownloadRequest request, String preset) {
        if (formats == null || formats.isEmpty()) {
            return null;
        }

        VideoFormatInfo direct = findFormatBySelector(formats, request.getFormat());
        if (direct != null) {
            return direct;
        }

        String quality = normalizePreset(preset);
        if (request.getType() == MediaType.AUDIO) {
            List<VideoFormatInfo> audioFormats = formats.stream()
                    .filter(this::isAudioOnly)
                    .sorted(Comparator.comparing(
                            (VideoFormatInfo f) -> f.getAbr() != null ? f.getAbr() : 0.0).reversed())
                    .collect(Collectors.toList());
            if (audioFormats.isEmpty()) {
                return null;
            }
            if ("worst".equals(quality)) {
                return audioFormats.get(audioFormats.size() - 1);
            }
            Integer targetAbr = "auto".equals(quality) ? null : PRESET_AUDIO_ABR.get(quality);
            return pickAtMost(audioFormats, targetAbr, f -> f.getAbr() != null ? f.getAbr() : 0.0);
        }

        List<VideoFormatInfo> videoFormats = formats.stream()
                .filter(f -> hasVideo(f) && f.getHeight() != null)
                .sorted(Comparator.comparing((VideoFormatInfo f) -> f.getHeight())
                        .thenComparing(f -> f.getTbr() != null ? f.getTbr() : 0.0)
                        .reversed())
                .collect(Collectors.toList());
        if (videoFormats.isEmpty()) {
            return null;
        }
        if ("worst".equals(quality)) {
            return videoFormats.get(videoFormats.size() - 1);
        }
        return pickAtMost(videoFormats, PRESET_HEIGHTS.get(quality), f -> f.getHeight().doubleValue());
    }

    // Ищет формат по первой части каждой альтернативы "a+b/c"
    public VideoFormatInfo findFormatBySelector(List<VideoFormatInfo> formats, String selector) {
        if (formats == null || selector == null || selector.isBlank()) {
            return null;
        }
        for (String alternative : selector.split("/")) {
            String primary = alternative.split("\\+")[0].trim();
            if (primary.isEmpty()) {
                continue;
            }
            for (VideoFormatInfo format : formats) {
                if (primary.equals(format.getFormat_id())) {
                    return format;
                }
            }
        }
        return null;
    }

    /**
     * Ищет формат по строке идентификаторов вида "137+140". Предпочитает формат с видео.
     */
    public VideoFormatInfo findFormatByIdCandidates(List<VideoFormatInfo> formats, String ids) {
        if (formats == null || formats.isEmpty() || ids == null || ids.isBlank()) {
            return null;
        }
        List<VideoFormatInfo> matches = new ArrayList<>();
        for (String id : ids.split("[+,]")) {
            String trimmed = id.trim();
            if (trimmed.isEmpty()) {
                continue;
            }
            formats.stream()
                    .filter(format -> trimmed.equals(format.getFormat_id()))
                    .findFirst()
                    .ifPresent(matches::add);
        }
        return matches.stream()
                .filter(this::hasVideo)
                .findFirst()
                .orElse(matches.isEmpty() ? null : matches.get(0));
    }

    /**
     * Разбирает размер из вывода yt-dlp: "~ 12.34MiB", "1,024KiB", "512B".
     */
    public static Long parseSizeToBytes(String value) {
        if (value == null) {
            return null;
        }
        String cleaned = value.replace("~", "").replace(",", "").trim();
        if (cleaned.isEmpty()) {
            return null;
        }
        Matcher matcher = RegexPatterns.SIZE_PATTERN.matcher(cleaned);
        if (!matcher.matches()) {
            return null;
        }
        double amount;
        try {
            amount = Double.parseDouble(matcher.group(1));
        } catch (NumberFormatException e) {
            return null;
        }
        double multiplier = switch (matcher.group(2).toUpperCase()) {
            case "KB" -> 1000d;
            case "KIB" -> 1024d;
            case "MB" -> 1000d * 1000;
            case "MIB" -> 1024d * 1024;
            case "GB" -> 1000d * 1000 * 1000;
            case "GIB" -> 1024d * 1024 * 1024;
            case "TB" -> 1000d * 1000 * 1000 * 1000;
            case "TIB" -> 1024d * 1024 * 1024 * 1024;
            default -> 1d;
        };
        return Math.round(amount * multiplier);
    }

    private VideoFormatInfo pickAtMost(List<VideoFormatInfo> sortedDesc, Integer limit,
                                       ToDoubleFunction<VideoFormatInfo> metric) {
        if (limit == null) {
            return sortedDesc.get(0);
        }
        return sortedDesc.stream()
                .filter(format -> metric.applyAsDouble(format) <= limit)
                .findFirst()
                .orElse(sortedDesc.get(sortedDesc.size() - 1));
    }

    private List<String> buildAudioSelectors(String quality) {
        if ("worst".equals(quality)) {
            return List.of("worstaudio", "bestaudio");
        }
        Integer abrLimit = "auto".equals(quality) ? null : PRESET_AUDIO_ABR.get(quality);
        return abrLimit != null
                ? List.of("bestaudio[abr<=" + abrLimit + "]", "bestaudio")
                : List.of("bestaudio");
    }

    private String normalizePreset(String preset) {
        if (preset == null || preset.isBlank()) {
            return "auto";
        }
        return preset.trim().toLowerCase();
    }

    private boolean hasVideo(VideoFormatInfo format) {
        return format.getVcodec() != null && !"none".equals(format.getVcodec());
    }

    private boolean isAudioOnly(VideoFormatInfo format) {
        return !hasVideo(format) && format.getAcodec() != null && !"none".equals(format.getAcodec());
    }

    private static List<String> nonBlank(List<String> values) {
        if (values == null) {
            return List.of();
        }
        return values.stream()
                .filter(value -> value != null && !value.trim().isEmpty())
                .collect(Collectors.toList());
    }
}
