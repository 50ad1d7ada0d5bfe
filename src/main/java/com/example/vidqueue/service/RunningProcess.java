package com.example.vidqueue.service;

/**
 * Запущенный внешний процесс.
 */
public interface RunningProcess {
    /**
     * Блокирует до завершения процесса и дочитывания его вывода.
     *
     * @return код выхода
     */
    int waitFor() throws InterruptedException;

    void cancel();

    boolean isAlive();
}
