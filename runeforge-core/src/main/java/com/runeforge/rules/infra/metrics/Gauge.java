package com.runeforge.rules.infra.metrics;

/**
 * Point-in-time value that can go up and down.
 */
public interface Gauge {
    void set(double value);

    double value();
}
