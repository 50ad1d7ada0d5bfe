package com.example.vidqueue.service;

import com.example.vidqueue.utils.model.DownloadRequest;
import com.example.vidqueue.utils.model.MediaType;
import com.example.vidqueue.utils.model.VideoFormatInfo;

import java.util.Arrays;
import java.util.List;

/**
 * Оценка числа отдельных передач (частей), из которых yt-dlp соберёт результат.
 */
public final class ProgressEstimator {
    private ProgressEstimator() {
    }

    public static int estimateParts(DownloadRequest request) {
        if (request.getType() == MediaType.AUDIO) {
            return 1;
        }

        long audioIds = countNonBlank(request.getAudioFormatIds());
        if (audioIds > 0) {
            return 1 + (int) audioIds;
        }

        String selector = request.getFormat() != null ? request.getFormat().trim() : "";
        if (selector.isEmpty()) {
            return 2;
        }

        // Учитываем только первую альтернативу из "a/b"
        String primary = selector.split("/", -1)[0].trim();
        if (primary.isEmpty()) {
            return 2;
        }

        List<String> parts = Arrays.stream(primary.split("\\+"))
                .map(String::trim)
                .filter(part -> !part.isEmpty())
                .toList();
        if (parts.size() <= 1) {
            return 1;
        }
        if (parts.contains("none")) {
            return 1;
        }
        return parts.size();
    }

    /**
     * Уточнение после получения метаданных: видео без дополнительных аудиодорожек,
     * у которого выбранный формат уже содержит и звук, и картинку, качается одной частью.
     */
    public static int refineParts(int estimated, DownloadRequest request, VideoFormatInfo selected) {
        if (request.getType() == MediaType.VIDEO
                && countNonBlank(request.getAudioFormatIds()) == 0
                && isMuxedFormat(selected)) {
            return 1;
        }
        return estimated;
    }

    public static boolean isMuxedFormat(VideoFormatInfo format) {
        if (format == null) {
            return false;
        }
        return hasCodec(format.getVcodec()) && hasCodec(format.getAcodec());
    }

    public static double clampPercent(Double value) {
        if (value == null || value.isNaN()) {
            return 0;
        }
        return Math.min(100, Math.max(0, value));
    }

    private static boolean hasCodec(String codec) {
        return codec != null && !codec.isBlank() && !"none".equalsIgnoreCase(codec.trim());
    }

    private static long countNonBlank(List<String> values) {
        if (values == null) {
            return 0;
        }
        return values.stream().filter(value -> value != null && !value.trim().isEmpty()).count();
    }
}
