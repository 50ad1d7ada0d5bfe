package com.example.vidqueue.utils.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class VideoInfo {
    private String id;
    private String title;
    private String thumbnail;
    private Double duration;
    private String description;
    private String uploader;
    private Long view_count;
    private String extractor_key;
    private String webpage_url;
    private List<VideoFormatInfo> formats;
}
