package com.example.vidqueue.utils.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PlaylistDownloadResult {
    private String groupId;
    private String playlistId;
    private String playlistTitle;
    private MediaType type;
    private int totalCount;
    private int startIndex;
    private int endIndex;
    private List<PlaylistDownloadEntry> entries;
}
