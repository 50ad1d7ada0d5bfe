package com.example.vidqueue.utils.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class QueueStatus {
    private int queued;
    private int active;
    private int maxConcurrent;
    private List<String> activeIds;
    private Map<DownloadStatus, Long> statusCounts;
}
