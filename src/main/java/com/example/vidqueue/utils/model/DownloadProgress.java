package com.example.vidqueue.utils.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DownloadProgress {
    private Double percent;
    private String currentSpeed;
    private String eta;
    private String downloaded;
    private String total;

    // Конструктор копирования
    public DownloadProgress(DownloadProgress other) {
        this.percent = other.percent;
        this.currentSpeed = other.currentSpeed;
        this.eta = other.eta;
        this.downloaded = other.downloaded;
        this.total = other.total;
    }

    public static DownloadProgress empty() {
        return DownloadProgress.builder().percent(0.0).build();
    }
}
