package com.example.vidqueue.utils.model;

import lombok.AllArgsConstructor;
import lombok.Data;

import java.nio.file.Path;

@Data
@AllArgsConstructor
public class TransformResult {
    private Path outputPath;
    private long fileSize;
}
