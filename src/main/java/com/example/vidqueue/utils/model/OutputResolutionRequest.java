package com.example.vidqueue.utils.model;

import lombok.Builder;
import lombok.Data;

import java.nio.file.Path;
import java.util.List;

@Data
@Builder
public class OutputResolutionRequest {
    // В порядке появления в логе
    private List<Path> candidates;
    private Path lastKnownPath;
    private Path fallbackPath;
    private Path directory;
    private String title;
    private String extension;
    private Long latestKnownSizeBytes;
}
