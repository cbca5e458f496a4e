package com.runeforge.rules.infra.metrics.impl.inmemory;

import com.runeforge.rules.infra.metrics.Timer;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Stores every recorded duration for assertions and percentile calculations.
 */
final class InMemoryTimer implements Timer {

    private final String key;
    private final List<Duration> recordings = new CopyOnWriteArrayList<>();

    InMemoryTimer(String key) {
        this.key = key;
    }

    @Override
    public <T> T record(Callable<T> callable) throws Exception {
        long startNanos = System.nanoTime();
        try {
            return callable.call();
        } finally {
            recordings.add(Duration.ofNanos(System.nanoTime() - startNanos));
        }
    }

    @Override
    public void record(Duration duration) {
        if (duration.isNegative()) {
            throw new IllegalArgumentException("Cannot record negative duration: " + duration);
        }
        recordings.add(duration);
    }

    /**
     * Nearest-rank percentile over the recorded durations.
     */
    @Override
    public Duration percentile(double percentile) {
        if (recordings.isEmpty()) {
            return Duration.ZERO;
        }
        double p = Math.max(0.0, Math.min(1.0, percentile));
        List<Duration> sorted = new ArrayList<>(recordings);
        Collections.sort(sorted);
        int index = (int) Math.ceil(p * sorted.size()) - 1;
        return sorted.get(Math.max(0, index));
    }

    List<Duration> getRecordings() {
        return List.copyOf(recordings);
    }

    @Override
    public String toString() {
        return String.format("InMemoryTimer{key='%s', count=%d}", key, recordings.size());
    }
}
