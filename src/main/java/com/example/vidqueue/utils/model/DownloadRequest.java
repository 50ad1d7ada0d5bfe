package com.example.vidqueue.utils.model;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

@Data
@Builder
@AllArgsConstructor
@NoArgsConstructor
public class DownloadRequest {
    @NotBlank(message = "URL is required")
    private String url;
    @NotNull(message = "Type is required")
    private MediaType type;
    private String format;
    private String audioFormat;
    private List<String> audioFormatIds;
    private String startTime;
    private String endTime;
    private String customDownloadPath;
    private String customFilenameTemplate;
    private DownloadOrigin origin;
    private String subscriptionId;
    private List<String> tags;

    // Конструктор копирования, списки копируются
    public DownloadRequest(DownloadRequest other) {
        this.url = other.url;
        this.type = other.type;
        this.format = other.format;
        this.audioFormat = other.audioFormat;
        this.audioFormatIds = other.audioFormatIds != null ? new ArrayList<>(other.audioFormatIds) : null;
        this.startTime = other.startTime;
        this.endTime = other.endTime;
        this.customDownloadPath = other.customDownloadPath;
        this.customFilenameTemplate = other.customFilenameTemplate;
        this.origin = other.origin;
        this.subscriptionId = other.subscriptionId;
        this.tags = other.tags != null ? new ArrayList<>(other.tags) : null;
    }
}
