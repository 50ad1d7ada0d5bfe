package com.example.vidqueue.utils.model;

import com.fasterxml.jackson.annotation.JsonProperty;

public enum DownloadStatus {
    @JsonProperty("pending") PENDING,
    @JsonProperty("downloading") DOWNLOADING,
    @JsonProperty("processing") PROCESSING,
    // Отмена запрошена, процесс ещё не завершился
    @JsonProperty("cancelling") CANCELLING,
    @JsonProperty("completed") COMPLETED,
    @JsonProperty("error") ERROR,
    @JsonProperty("cancelled") CANCELLED;

    public boolean isTerminal() {
        return this == COMPLETED || this == ERROR || this == CANCELLED;
    }
}
