package com.example.vidqueue.service;

import com.example.vidqueue.config.ApplicationConfig;
import com.example.vidqueue.utils.model.DownloadRequest;

import java.util.List;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

public interface ArgumentBuilder {
    Pattern NEEDS_QUOTING = Pattern.compile("[\\s\"'\\\\]");

    /**
     * Аргументы загрузчика. URL всегда последний.
     */
    List<String> buildArgs(DownloadRequest request, String downloadPath, ApplicationConfig settings,
                           List<String> extraArgs);

    // Печатаемая команда для диагностики
    default String formatCommand(List<String> args) {
        return "yt-dlp " + args.stream().map(arg -> {
            if (arg.isEmpty()) {
                return "\"\"";
            }
            if (NEEDS_QUOTING.matcher(arg).find()) {
                return "\"" + arg.replaceAll("([\"\\\\])", "\\\\$1") + "\"";
            }
            return arg;
        }).collect(Collectors.joining(" "));
    }
}
