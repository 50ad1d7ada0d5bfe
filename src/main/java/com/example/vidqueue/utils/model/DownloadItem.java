package com.example.vidqueue.utils.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Изменяемая запись о загрузке. Все поля необязательные: тот же класс служит частичным
 * обновлением для {@link #merge(DownloadItem)}, где побеждают ненулевые поля.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DownloadItem {
    private String id;
    private String url;
    private MediaType type;

    private String title;
    private String thumbnail;
    private Double duration;
    private String uploader;
    private String description;
    private Long viewCount;

    private volatile DownloadStatus status;
    private DownloadProgress progress;
    private String speed;

    private Long createdAt;
    private Long startedAt;
    private Long completedAt;

    private VideoFormatInfo selectedFormat;
    private String savedFileName;
    private Long fileSize;
    private String error;
    private String ytDlpCommand;
    private String ytDlpLog;

    private List<String> tags;
    private DownloadOrigin origin;
    private String subscriptionId;

    private String playlistId;
    private String playlistTitle;
    private Integer playlistIndex;
    private Integer playlistSize;

    public synchronized void merge(DownloadItem patch) {
        if (patch == null) {
            return;
        }
        if (patch.id != null) this.id = patch.id;
        if (patch.url != null) this.url = patch.url;
        if (patch.type != null) this.type = patch.type;
        if (patch.title != null) this.title = patch.title;
        if (patch.thumbnail != null) this.thumbnail = patch.thumbnail;
        if (patch.duration != null) this.duration = patch.duration;
        if (patch.uploader != null) this.uploader = patch.uploader;
        if (patch.description != null) this.description = patch.description;
        if (patch.viewCount != null) this.viewCount = patch.viewCount;
        if (patch.status != null) this.status = patch.status;
        if (patch.progress != null) this.progress = new DownloadProgress(patch.progress);
        if (patch.speed != null) this.speed = patch.speed;
        if (patch.createdAt != null) this.createdAt = patch.createdAt;
        if (patch.startedAt != null) this.startedAt = patch.startedAt;
        if (patch.completedAt != null) this.completedAt = patch.completedAt;
        if (patch.selectedFormat != null) this.selectedFormat = patch.selectedFormat;
        if (patch.savedFileName != null) this.savedFileName = patch.savedFileName;
        if (patch.fileSize != null) this.fileSize = patch.fileSize;
        if (patch.error != null) this.error = patch.error;
        if (patch.ytDlpCommand != null) this.ytDlpCommand = patch.ytDlpCommand;
        if (patch.ytDlpLog != null) this.ytDlpLog = patch.ytDlpLog;
        if (patch.tags != null) this.tags = new ArrayList<>(patch.tags);
        if (patch.origin != null) this.origin = patch.origin;
        if (patch.subscriptionId != null) this.subscriptionId = patch.subscriptionId;
        if (patch.playlistId != null) this.playlistId = patch.playlistId;
        if (patch.playlistTitle != null) this.playlistTitle = patch.playlistTitle;
        if (patch.playlistIndex != null) this.playlistIndex = patch.playlistIndex;
        if (patch.playlistSize != null) this.playlistSize = patch.playlistSize;
    }

    public synchronized DownloadItem copy() {
        DownloadItem copy = new DownloadItem();
        copy.merge(this);
        return copy;
    }
}
