package com.example.vidqueue.utils.model;

import com.fasterxml.jackson.annotation.JsonProperty;

public enum MediaType {
    @JsonProperty("video") VIDEO,
    @JsonProperty("audio") AUDIO
}
