package com.runeforge.rules.infra.metrics.impl.inmemory;

import com.runeforge.rules.infra.metrics.Gauge;

final class InMemoryGauge implements Gauge {
    private volatile double value;

    @Override
    public void set(double value) {
        this.value = value;
    }

    @Override
    public double value() {
        return value;
    }
}
