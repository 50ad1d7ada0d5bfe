package com.example.vidqueue.utils.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class DownloadSession {
    public static final int VERSION = 1;

    private int version;
    private long updatedAt;
    private List<DownloadSessionItem> items;
}
