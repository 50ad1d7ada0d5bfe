package com.example.vidqueue.service;

import com.example.vidqueue.utils.model.TransformOptions;
import com.example.vidqueue.utils.model.TransformResult;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Optional;

public interface Transcoder {
    /**
     * Путь к исполняемому файлу перекодировщика.
     *
     * @throws IOException если он не найден
     */
    Path resolveLocation() throws IOException;

    /**
     * Перекодирует файл на месте. Пустой результат означает, что преобразование не выполнялось.
     */
    Optional<TransformResult> transform(Path input, TransformOptions options) throws IOException, InterruptedException;
}
