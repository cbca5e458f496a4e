package com.runeforge.rules.infra.metrics.impl.inmemory;

import com.runeforge.rules.infra.metrics.Counter;

import java.util.concurrent.atomic.AtomicLong;

final class InMemoryCounter implements Counter {
    private final AtomicLong value = new AtomicLong(0);
    private final String key;

    InMemoryCounter(String key) {
        this.key = key;
    }

    @Override
    public void increment() {
        increment(1);
    }

    @Override
    public void increment(long amount) {
        value.addAndGet(amount);
    }

    @Override
    public long count() {
        return value.get();
    }

    @Override
    public String toString() {
        return "InMemoryCounter{" + key + "=" + value.get() + "}";
    }
}
