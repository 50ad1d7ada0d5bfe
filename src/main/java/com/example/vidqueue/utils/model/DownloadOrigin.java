package com.example.vidqueue.utils.model;

import com.fasterxml.jackson.annotation.JsonProperty;

public enum DownloadOrigin {
    @JsonProperty("manual") MANUAL,
    @JsonProperty("subscription") SUBSCRIPTION;

    public String key() {
        return this == MANUAL ? "manual" : "subscription";
    }
}
