package com.example.vidqueue.utils.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PlaylistEntry {
    private String id;
    private String title;
    private String url;
    private int index;
}
