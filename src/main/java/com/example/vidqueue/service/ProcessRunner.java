package com.example.vidqueue.service;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

public interface ProcessRunner {
    RunningProcess start(List<String> args, Path workingDirectory, ProcessOutputListener listener) throws IOException;
}
