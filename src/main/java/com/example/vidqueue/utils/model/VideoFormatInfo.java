package com.example.vidqueue.utils.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class VideoFormatInfo {
    private String format_id;
    private String ext;
    private String vcodec;
    private String acodec;
    private String video_ext;
    private String audio_ext;
    private Integer height;
    private Integer width;
    private Double fps;
    private Double tbr;
    private Double abr;
    private Long filesize;
    private Long filesize_approx;
    private String format;
    private String format_note;
    private String url;
    private String protocol;
}
