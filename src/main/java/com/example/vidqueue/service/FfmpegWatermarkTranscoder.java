package com.example.vidqueue.service;

import com.example.vidqueue.config.ApplicationConfig;
import com.example.vidqueue.utils.model.TransformOptions;
import com.example.vidqueue.utils.model.TransformResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.io.BufferedReader;
import java.io.File;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Накладывает через ffmpeg drawtext подпись "название, автор, Downloaded with ..."
 * и подменяет исходный файл результатом.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class FfmpegWatermarkTranscoder implements Transcoder {
    private static final int TITLE_MAX = 28;
    private static final int AUTHOR_MAX = 60;
    private static final List<String> KEEP_CONTAINERS = List.of("mp4", "m4v", "mov", "mkv");
    private static final List<String> FASTSTART_CONTAINERS = List.of("mp4", "m4v", "mov");

    private static final Pattern INVISIBLE = Pattern.compile(
            "[\\p{Cc}\\p{Cf}\\p{Co}\\p{Cn}\\x{1F000}-\\x{1FAFF}\\x{2600}-\\x{27BF}\\uFE00-\\uFE0F\\uFFFD]");
    private static final Pattern CJK = Pattern.compile("[\\u3040-\\u30ff\\u3400-\\u4dbf\\u4e00-\\u9fff\\uac00-\\ud7af]");
    private static final Pattern CYRILLIC = Pattern.compile("[\\u0400-\\u04ff]");

    private final ApplicationConfig appConfig;

    @Value("${ffmpeg.path}") private String ffmpegPath;

    @Override
    public Path resolveLocation() throws IOException {
        if (ffmpegPath == null || ffmpegPath.isBlank()) {
            throw new IOException("ffmpeg path is not configured");
        }
        Path configured = Paths.get(ffmpegPath.trim());
        if (Files.isRegularFile(configured)) {
            return configured.toAbsolutePath();
        }
        // Просто имя команды: ищем в PATH
        if (configured.getParent() == null) {
            String path = System.getenv("PATH");
            if (path != null) {
                for (String dir : path.split(Pattern.quote(File.pathSeparator))) {
                    if (dir.isBlank()) {
                        continue;
                    }
                    for (String name : List.of(ffmpegPath.trim(), ffmpegPath.trim() + ".exe")) {
                        Path candidate = Paths.get(dir, name);
                        if (Files.isRegularFile(candidate)) {
                            return candidate.toAbsolutePath();
                        }
                    }
                }
            }
        }
        throw new IOException("ffmpeg not found at: " + ffmpegPath);
    }

    @Override
    public Optional<TransformResult> transform(Path input, TransformOptions options)
            throws IOException, InterruptedException {
        if (input == null) {
            return Optional.empty();
        }

        Path ffmpeg = resolveLocation();
        Path dir = input.toAbsolutePath().getParent();
        String fileName = input.getFileName().toString();
        int dot = fileName.lastIndexOf('.');
        String base = dot > 0 ? fileName.substring(0, dot) : fileName;
        String ext = dot > 0 ? fileName.substring(dot + 1).toLowerCase() : "";
        String outputExt = KEEP_CONTAINERS.contains(ext) ? ext : "mp4";

        String marker = appConfig.getBrandingMarker().toLowerCase();
        Path outputPath = dir.resolve(base + "." + outputExt);
        Path tempOutputPath = dir.resolve(base + "." + marker + "-watermark." + System.currentTimeMillis() + "." + outputExt);

        String watermarkText = buildWatermarkText(options.getTitle(), options.getAuthor());
        Path textFile = Files.createTempFile(marker + "-watermark-", ".txt");
        boolean outputReady = false;

        try {
            Files.writeString(textFile, watermarkText, StandardCharsets.UTF_8);
            String fontFile = resolveFontFile(watermarkText);

            List<String> command = new ArrayList<>(List.of(
                    ffmpeg.toString(), "-y", "-hide_banner",
                    "-i", input.toString(),
                    "-vf", buildDrawTextFilter(textFile, fontFile),
                    "-c:v", "libx264", "-preset", "veryfast", "-crf", "23",
                    "-c:a", "aac", "-b:a", "192k"));
            if (FASTSTART_CONTAINERS.contains(outputExt)) {
                command.addAll(List.of("-movflags", "+faststart"));
            }
            command.add(tempOutputPath.toString());

            executeFfmpegCommand(command);
            replaceOutputFile(outputPath, tempOutputPath);
            outputReady = true;

            if (!outputPath.equals(input.toAbsolutePath())) {
                Files.deleteIfExists(input);
            }

            long size = Files.size(outputPath);
            log.info("Watermark applied: {} ({} bytes)", outputPath, size);
            return Optional.of(new TransformResult(outputPath, size));
        } finally {
            deleteQuietly(textFile);
            if (!outputReady) {
                deleteQuietly(tempOutputPath);
            }
        }
    }

    String buildWatermarkText(String title, String author) {
        String titleLine = normalizeLine(title, "Untitled video", TITLE_MAX);
        String authorLine = "by " + normalizeLine(author, "Unknown author", AUTHOR_MAX - 3);
        return String.join(" ", titleLine, authorLine, "Downloaded with " + appConfig.getBrandingMarker());
    }

    private String normalizeLine(String value, String fallback, int maxLength) {
        String cleaned = INVISIBLE.matcher(value != null ? value : "").replaceAll("");
        String trimmed = cleaned.replaceAll("\\s+", " ").trim();
        String resolved = trimmed.isEmpty() ? fallback : trimmed;
        if (resolved.length() <= maxLength) {
            return resolved;
        }
        return resolved.substring(0, Math.max(0, maxLength - 3)) + "...";
    }

    private String buildDrawTextFilter(Path textFile, String fontFile) {
        String fontSize = "max(14\\, min(44\\, h*0.024))";
        String edgePadding = "max(8\\, h*0.018)";
        List<String> options = new ArrayList<>();
        options.add("textfile=" + escapeFilterValue(textFile.toString()));
        if (fontFile != null) {
            options.add("fontfile=" + escapeFilterValue(fontFile));
        }
        options.add("fontcolor=white");
        options.add("text_align=right");
        options.add("shadowcolor=black@0.7");
        options.add("shadowx=1");
        options.add("shadowy=1");
        options.add("fontsize=" + fontSize);
        options.add("x=w-tw-" + edgePadding);
        options.add("y=h-th-" + edgePadding);
        return "drawtext=" + String.join(":", options);
    }

    private static String escapeFilterValue(String value) {
        return value.replace("\\", "\\\\").replace(":", "\\:").replace("'", "\\'");
    }

    private String resolveFontFile(String text) {
        for (String candidate : buildFontCandidates(text)) {
            if (Files.exists(Paths.get(candidate))) {
                log.debug("Using watermark font {}", candidate);
                return candidate;
            }
        }
        log.warn("No suitable watermark font found, ffmpeg default will be used");
        return null;
    }

    private List<String> buildFontCandidates(String text) {
        String os = System.getProperty("os.name", "").toLowerCase();
        List<String> base;
        List<String> cjk;
        List<String> cyrillic;
        if (os.contains("mac")) {
            base = List.of("/System/Library/Fonts/Supplemental/Arial Unicode.ttf",
                    "/Library/Fonts/Arial Unicode.ttf",
                    "/System/Library/Fonts/Supplemental/Arial.ttf",
                    "/System/Library/Fonts/Helvetica.ttc");
            cjk = List.of("/System/Library/Fonts/Supplemental/Arial Unicode.ttf",
                    "/System/Library/Fonts/STHeiti Medium.ttc",
                    "/System/Library/Fonts/Hiragino Sans GB.ttc",
                    "/System/Library/Fonts/PingFang.ttc",
                    "/System/Library/Fonts/AppleSDGothicNeo.ttc");
            cyrillic = List.of("/System/Library/Fonts/Supplemental/Arial.ttf");
        } else if (os.contains("win")) {
            base = List.of("C:\\Windows\\Fonts\\segoeui.ttf", "C:\\Windows\\Fonts\\arial.ttf",
                    "C:\\Windows\\Fonts\\tahoma.ttf");
            cjk = List.of("C:\\Windows\\Fonts\\msyh.ttc", "C:\\Windows\\Fonts\\simhei.ttf",
                    "C:\\Windows\\Fonts\\meiryo.ttc", "C:\\Windows\\Fonts\\malgun.ttf");
            cyrillic = List.of("C:\\Windows\\Fonts\\arial.ttf", "C:\\Windows\\Fonts\\segoeui.ttf");
        } else {
            base = List.of("/usr/share/fonts/truetype/dejavu/DejaVuSans.ttf",
                    "/usr/share/fonts/truetype/noto/NotoSans-Regular.ttf",
                    "/usr/share/fonts/truetype/liberation/LiberationSans-Regular.ttf");
            cjk = List.of("/usr/share/fonts/opentype/noto/NotoSansCJK-Regular.ttc",
                    "/usr/share/fonts/truetype/noto/NotoSansCJK-Regular.ttc",
                    "/usr/share/fonts/truetype/wqy/wqy-microhei.ttc",
                    "/usr/share/fonts/truetype/wqy/wqy-zenhei.ttc");
            cyrillic = List.of("/usr/share/fonts/truetype/dejavu/DejaVuSans.ttf");
        }

        Set<String> ordered = new LinkedHashSet<>();
        if (CJK.matcher(text).find()) {
            ordered.addAll(cjk);
        } else if (CYRILLIC.matcher(text).find()) {
            ordered.addAll(cyrillic);
        }
        ordered.addAll(base);
        return new ArrayList<>(ordered);
    }

    private void executeFfmpegCommand(List<String> command) throws IOException, InterruptedException {
        log.info("FFmpeg watermark command: {}", String.join(" ", command));

        Process process = new ProcessBuilder(command).redirectOutput(ProcessBuilder.Redirect.DISCARD).start();
        StringBuilder errorOutput = new StringBuilder();
        Thread errorReader = new Thread(() -> {
            try (BufferedReader reader = new BufferedReader(
                    new InputStreamReader(process.getErrorStream(), StandardCharsets.UTF_8))) {
                String line;
                while ((line = reader.readLine()) != null) {
                    log.debug("FFmpeg: {}", line);
                    synchronized (errorOutput) {
                        errorOutput.append(line).append("\n");
                    }
                }
            } catch (IOException e) {
                log.error("Error reading FFmpeg output: {}", e.getMessage());
            }
        });
        errorReader.start();

        int exitCode = process.waitFor();
        errorReader.join();

        if (exitCode != 0) {
            String stderr;
            synchronized (errorOutput) {
                stderr = errorOutput.toString().trim();
            }
            throw new IOException("ffmpeg exited with code " + exitCode + ": " + stderr);
        }
    }

    private void replaceOutputFile(Path outputPath, Path tempPath) throws IOException {
        Path backupPath = null;
        if (Files.exists(outputPath)) {
            backupPath = outputPath.resolveSibling(outputPath.getFileName() + "."
                    + appConfig.getBrandingMarker().toLowerCase() + "-backup-" + System.currentTimeMillis());
            Files.move(outputPath, backupPath, StandardCopyOption.REPLACE_EXISTING);
        }

        try {
            Files.move(tempPath, outputPath, StandardCopyOption.REPLACE_EXISTING);
        } catch (IOException e) {
            if (backupPath != null) {
                Files.move(backupPath, outputPath, StandardCopyOption.REPLACE_EXISTING);
            }
            throw e;
        }
        if (backupPath != null) {
            deleteQuietly(backupPath);
        }
    }

    private void deleteQuietly(Path path) {
        try {
            Files.deleteIfExists(path);
        } catch (IOException e) {
            log.warn("Failed to delete temporary file {}: {}", path, e.getMessage());
        }
    }
}
