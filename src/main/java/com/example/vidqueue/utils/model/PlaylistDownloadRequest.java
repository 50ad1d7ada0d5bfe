package com.example.vidqueue.utils.model;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PlaylistDownloadRequest {
    @NotBlank(message = "URL is required")
    private String url;
    @NotNull(message = "Type is required")
    private MediaType type;
    private String format;
    // Границы выборки, 1-based, включительно
    private Integer startIndex;
    private Integer endIndex;
    private String customDownloadPath;
}
