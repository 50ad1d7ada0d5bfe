package com.example.vidqueue.utils.model;

public enum AdmissionResult {
    QUEUED,
    STARTED,
    ALREADY_EXISTS,
    DUPLICATE;

    public boolean isAccepted() {
        return this == QUEUED || this == STARTED;
    }
}
