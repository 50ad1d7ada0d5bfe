package com.example.vidqueue.utils.model;

import lombok.AllArgsConstructor;
import lombok.Data;

import java.nio.file.Path;

@Data
@AllArgsConstructor
public class ResolvedOutput {
    private Path path;
    private Long size;
    // Файл действительно найден на диске
    private boolean located;
}
