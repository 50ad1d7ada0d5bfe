package com.example.vidqueue.service;

import com.example.vidqueue.utils.model.DownloadOrigin;
import com.example.vidqueue.utils.model.DownloadRequest;

import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Ключ логической задачи: два запроса с одинаковым ключом считаются одной загрузкой.
 */
public final class DownloadSignature {
    private static final String DELIMITER = "|";

    private DownloadSignature() {
    }

    public static String of(DownloadRequest request) {
        DownloadOrigin origin = request.getOrigin() != null ? request.getOrigin() : DownloadOrigin.MANUAL;
        return String.join(DELIMITER,
                normalize(request.getUrl()),
                request.getType() != null ? request.getType().name().toLowerCase() : "",
                normalize(request.getFormat()),
                normalize(request.getAudioFormat()),
                normalizeList(request.getAudioFormatIds()),
                normalize(request.getStartTime()),
                normalize(request.getEndTime()),
                normalize(request.getCustomDownloadPath()),
                normalize(request.getCustomFilenameTemplate()),
                origin.key(),
                normalize(request.getSubscriptionId()));
    }

    private static String normalize(String value) {
        return value != null ? value.trim() : "";
    }

    private static String normalizeList(List<String> values) {
        if (values == null) {
            return "";
        }
        return values.stream()
                .filter(Objects::nonNull)
                .map(String::trim)
                .filter(value -> !value.isEmpty())
                .distinct()
                .sorted()
                .collect(Collectors.joining(","));
    }
}
