package com.example.vidqueue.utils.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PlaylistDownloadEntry {
    private String downloadId;
    private String entryId;
    private String title;
    private String url;
    private int index;
}
