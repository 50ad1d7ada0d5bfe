package com.example.vidqueue.service;

import com.example.vidqueue.utils.model.PlaylistInfo;
import com.example.vidqueue.utils.model.VideoInfo;

import java.io.IOException;

public interface InfoProvider {
    VideoInfo getVideoInfo(String url) throws IOException, InterruptedException;

    PlaylistInfo getPlaylistInfo(String url) throws IOException, InterruptedException;
}
