package com.example.vidqueue.service;

import com.example.vidqueue.config.ApplicationConfig;
import com.example.vidqueue.utils.model.MediaType;
import com.example.vidqueue.utils.model.OutputResolutionRequest;
import com.example.vidqueue.utils.model.ResolvedOutput;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.FileTime;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class OutputResolverTest {

    @TempDir
    Path dir;

    private OutputResolver resolver;

    @BeforeEach
    void setUp() {
        ApplicationConfig config = new ApplicationConfig();
        resolver = new OutputResolver(new DownloadPathService(config), config);
    }

    private Path write(String name, int size) throws IOException {
        Path file = dir.resolve(name);
        Files.write(file, new byte[size]);
        return file;
    }

    private OutputResolutionRequest.OutputResolutionRequestBuilder request() {
        return OutputResolutionRequest.builder()
                .candidates(List.of())
                .directory(dir)
                .fallbackPath(dir.resolve("Song.mp4"))
                .title("Song")
                .extension("mp4");
    }

    @Test
    void extensionFallbacks() {
        assertThat(OutputResolver.resolveExtension(MediaType.VIDEO, "webm", true)).isEqualTo("webm");
        assertThat(OutputResolver.resolveExtension(MediaType.VIDEO, null, true)).isEqualTo("mkv");
        assertThat(OutputResolver.resolveExtension(MediaType.VIDEO, " ", false)).isEqualTo("mp4");
        assertThat(OutputResolver.resolveExtension(MediaType.AUDIO, null, false)).isEqualTo("m4a");
    }

    @Test
    void fallbackPathUsesSanitizedTitle() {
        assertThat(resolver.buildFallbackPath(dir, "a/b: c", "mp4")).isEqualTo(dir.resolve("a_b_ c.mp4"));
        assertThat(resolver.buildFallbackPath(dir, null, "m4a")).isEqualTo(dir.resolve("Unknown.m4a"));
    }

    @Test
    void latestObservedCandidateWins() throws IOException {
        Path part = write("Song.f137.mp4", 10);
        Path merged = write("Song via Vidqueue.mp4", 30);

        ResolvedOutput output = resolver.resolve(request().candidates(List.of(part, merged)).lastKnownPath(merged).build());

        assertThat(output.getPath()).isEqualTo(merged);
        assertThat(output.getSize()).isEqualTo(30L);
        assertThat(output.isLocated()).isTrue();
    }

    @Test
    void skipsCandidatesThatNoLongerExist() throws IOException {
        Path kept = write("Song.webm", 12);

        ResolvedOutput output = resolver.resolve(request()
                .candidates(List.of(kept, dir.resolve("Song.f137.mp4.part")))
                .build());

        assertThat(output.getPath()).isEqualTo(kept);
        assertThat(output.getSize()).isEqualTo(12L);
    }

    @Test
    void fallbackPathIsChecked() throws IOException {
        Path fallback = write("Song.mp4", 7);

        ResolvedOutput output = resolver.resolve(request().build());

        assertThat(output.getPath()).isEqualTo(fallback);
        assertThat(output.isLocated()).isTrue();
    }

    @Test
    void directoryScanPrefersTitleMatch() throws IOException {
        write("other.mp4", 5);
        Path match = write("My Song via Vidqueue.mp4", 9);
        write("My Song via Vidqueue.txt", 1);

        ResolvedOutput output = resolver.resolve(request().title("My Song").fallbackPath(dir.resolve("missing.mp4")).build());

        assertThat(output.getPath()).isEqualTo(match);
        assertThat(output.getSize()).isEqualTo(9L);
    }

    @Test
    void directoryScanFallsBackToBrandedThenNewest() throws IOException {
        Path plain = write("plain.mp4", 3);
        Path branded = write("Renamed via Vidqueue.mp4", 4);
        Files.setLastModifiedTime(branded, FileTime.fromMillis(1_000));
        Files.setLastModifiedTime(plain, FileTime.fromMillis(2_000));

        ResolvedOutput output = resolver.resolve(request().title("Completely different").fallbackPath(null).build());
        assertThat(output.getPath()).isEqualTo(branded);

        Files.delete(branded);
        Path newer = write("newer.mp4", 6);
        Files.setLastModifiedTime(newer, FileTime.fromMillis(3_000));

        output = resolver.resolve(request().title("Completely different").fallbackPath(null).build());
        assertThat(output.getPath()).isEqualTo(newer);
    }

    @Test
    void missingFileUsesLatestKnownSize() {
        Path expected = dir.resolve("gone").resolve("Song.mp4");

        ResolvedOutput output = resolver.resolve(request()
                .directory(dir.resolve("gone"))
                .lastKnownPath(expected)
                .latestKnownSizeBytes(4096L)
                .build());

        assertThat(output.getPath()).isEqualTo(expected);
        assertThat(output.getSize()).isEqualTo(4096L);
        assertThat(output.isLocated()).isFalse();
    }

    @Test
    void nothingKnownLeavesSizeEmpty() {
        ResolvedOutput output = resolver.resolve(request().directory(dir.resolve("gone")).build());

        assertThat(output.getPath()).isEqualTo(dir.resolve("Song.mp4"));
        assertThat(output.getSize()).isNull();
        assertThat(output.isLocated()).isFalse();
    }
}
