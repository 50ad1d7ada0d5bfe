package com.example.vidqueue.utils.constants;

import java.util.regex.Pattern;

public class RegexPatterns {
    // [download]  45.2% of ~ 12.34MiB at 1.23MiB/s ETA 00:10
    public static final Pattern PROGRESS_PATTERN = Pattern.compile(
            "\\[download]\\s+(\\d+(?:\\.\\d+)?)%(?:\\s+of\\s+(~?\\s*\\S+))?(?:\\s+at\\s+(\\S+(?: B/s)?))?(?:\\s+ETA\\s+(\\S+))?");
    public static final Pattern EVENT_PATTERN = Pattern.compile("^\\[([\\w:-]+)]\\s*(.*)$");

    public static final Pattern DESTINATION_PATTERN = Pattern.compile("Destination:\\s*(.+)$");
    public static final Pattern MERGER_PATTERN = Pattern.compile("Merging formats into\\s+\"(.+?)\"");
    public static final Pattern MOVING_PATTERN = Pattern.compile("Moving file(?:\\s+\".+?\")?\\s+to\\s+\"(.+?)\"");

    public static final Pattern INFO_FORMATS_PATTERN = Pattern.compile("Downloading \\d+ format\\(s\\):\\s*(\\S+)");
    public static final Pattern DOWNLOAD_FORMAT_PATTERN = Pattern.compile("format\\s+([0-9A-Za-z+-]+)");

    public static final Pattern SIZE_PATTERN = Pattern.compile("^([\\d.]+)\\s*([KMGT]?i?B)$", Pattern.CASE_INSENSITIVE);

    public static final Pattern ILLEGAL_FILENAME_CHARS = Pattern.compile("[<>:\"/\\\\|?*]");
    public static final Pattern FILENAME_KEY_STRIP = Pattern.compile(
            "[^a-z0-9\\u3040-\\u30ff\\u3400-\\u4dbf\\u4e00-\\u9fff\\uac00-\\ud7af]+");
}
