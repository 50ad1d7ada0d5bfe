package com.example.vidqueue.utils.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class DownloadResponse {
    private boolean success;
    private String message;
    private String id;
    private AdmissionResult admission;
    private String error;

    public DownloadResponse(boolean success, String message, String id, AdmissionResult admission) {
        this(success, message, id, admission, null);
    }
}
