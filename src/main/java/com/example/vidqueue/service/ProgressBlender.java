package com.example.vidqueue.service;

/**
 * Сводит проценты отдельных частей в общий прогресс задачи.
 * Новая часть распознаётся, когда процент падает с 90+ до 10 и ниже.
 */
public class ProgressBlender {
    private static final double PART_END_THRESHOLD = 90;
    private static final double PART_START_THRESHOLD = 10;

    private int totalParts;
    private int completedParts = 0;
    private double lastPercent = 0;

    public ProgressBlender(int totalParts) {
        this.totalParts = Math.max(1, totalParts);
    }

    public synchronized void setTotalParts(int totalParts) {
        this.totalParts = Math.max(1, totalParts);
    }

    public synchronized int getTotalParts() {
        return totalParts;
    }

    public synchronized double update(Double percent) {
        double current = ProgressEstimator.clampPercent(percent);

        if (totalParts > 1
                && lastPercent >= PART_END_THRESHOLD
                && current <= PART_START_THRESHOLD
                && completedParts < totalParts - 1) {
            completedParts++;
        }
        lastPercent = current;

        double blended = totalParts > 1
                ? ((completedParts + current / 100) / totalParts) * 100
                : current;
        return Math.min(100, blended);
    }
}
