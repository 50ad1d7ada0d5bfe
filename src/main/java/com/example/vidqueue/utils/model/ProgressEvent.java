package com.example.vidqueue.utils.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Одна строка прогресса yt-dlp: процент текущего потока, скорость, ETA и размеры в исходном виде.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ProgressEvent {
    private Double percent;
    private String currentSpeed;
    private String eta;
    private String downloaded;
    private String total;
}
