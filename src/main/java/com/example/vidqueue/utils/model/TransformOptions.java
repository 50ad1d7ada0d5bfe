package com.example.vidqueue.utils.model;

import lombok.Builder;
import lombok.Data;

@Data
@Builder
public class TransformOptions {
    private String title;
    private String author;
}
