package com.example.vidqueue.utils.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class HistoryItem {
    private String id;
    private String url;
    private String title;
    private String thumbnail;
    private MediaType type;
    private DownloadStatus status;
    private String downloadPath;
    private String savedFileName;
    private Long fileSize;
    private Double duration;
    private Long downloadedAt;
    private Long completedAt;
    private String error;
    private String ytDlpCommand;
    private String ytDlpLog;
    private String description;
    private String uploader;
    private Long viewCount;
    private List<String> tags;
    private DownloadOrigin origin;
    private String subscriptionId;
    private VideoFormatInfo selectedFormat;
    private String playlistId;
    private String playlistTitle;
    private Integer playlistIndex;
    private Integer playlistSize;

    // Конструктор копирования
    public HistoryItem(HistoryItem other) {
        this();
        merge(other);
    }

    public void merge(HistoryItem patch) {
        if (patch == null) {
            return;
        }
        if (patch.id != null) this.id = patch.id;
        if (patch.url != null) this.url = patch.url;
        if (patch.title != null) this.title = patch.title;
        if (patch.thumbnail != null) this.thumbnail = patch.thumbnail;
        if (patch.type != null) this.type = patch.type;
        if (patch.status != null) this.status = patch.status;
        if (patch.downloadPath != null) this.downloadPath = patch.downloadPath;
        if (patch.savedFileName != null) this.savedFileName = patch.savedFileName;
        if (patch.fileSize != null) this.fileSize = patch.fileSize;
        if (patch.duration != null) this.duration = patch.duration;
        if (patch.downloadedAt != null) this.downloadedAt = patch.downloadedAt;
        if (patch.completedAt != null) this.completedAt = patch.completedAt;
        if (patch.error != null) this.error = patch.error;
        if (patch.ytDlpCommand != null) this.ytDlpCommand = patch.ytDlpCommand;
        if (patch.ytDlpLog != null) this.ytDlpLog = patch.ytDlpLog;
        if (patch.description != null) this.description = patch.description;
        if (patch.uploader != null) this.uploader = patch.uploader;
        if (patch.viewCount != null) this.viewCount = patch.viewCount;
        if (patch.tags != null) this.tags = new ArrayList<>(patch.tags);
        if (patch.origin != null) this.origin = patch.origin;
        if (patch.subscriptionId != null) this.subscriptionId = patch.subscriptionId;
        if (patch.selectedFormat != null) this.selectedFormat = patch.selectedFormat;
        if (patch.playlistId != null) this.playlistId = patch.playlistId;
        if (patch.playlistTitle != null) this.playlistTitle = patch.playlistTitle;
        if (patch.playlistIndex != null) this.playlistIndex = patch.playlistIndex;
        if (patch.playlistSize != null) this.playlistSize = patch.playlistSize;
    }

    /**
     * Переносит из частичного обновления записи только поля, которые хранятся в истории.
     */
    public static HistoryItem fromRecordPatch(DownloadItem patch) {
        return HistoryItem.builder()
                .title(patch.getTitle())
                .thumbnail(patch.getThumbnail())
                .duration(patch.getDuration())
                .fileSize(patch.getFileSize())
                .description(patch.getDescription())
                .uploader(patch.getUploader())
                .viewCount(patch.getViewCount())
                .tags(patch.getTags())
                .origin(patch.getOrigin())
                .subscriptionId(patch.getSubscriptionId())
                .selectedFormat(patch.getSelectedFormat())
                .playlistId(patch.getPlaylistId())
                .playlistTitle(patch.getPlaylistTitle())
                .playlistIndex(patch.getPlaylistIndex())
                .playlistSize(patch.getPlaylistSize())
                .status(patch.getStatus())
                .completedAt(patch.getCompletedAt())
                .error(patch.getError())
                .ytDlpCommand(patch.getYtDlpCommand())
                .ytDlpLog(patch.getYtDlpLog())
                .savedFileName(patch.getSavedFileName())
                .build();
    }

    @JsonIgnore
    public boolean isEmpty() {
        return new HistoryItem().equals(this);
    }
}
