package com.runeforge.rules.runtime.choice;

import com.runeforge.rules.api.model.ChoiceSnapshot;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

class InMemoryChoiceStoreTest {

    private final InMemoryChoiceStore store = new InMemoryChoiceStore();

    @Test
    @DisplayName("Selections are recorded, replaced and cleared")
    void selections() {
        assertThat(store.isResolved("ancestry")).isFalse();

        store.select("ancestry", List.of("dwarf"));
        store.select("ancestry", List.of("elf"));
        assertThat(store.selection("ancestry")).containsExactly("elf");

        store.clear("ancestry");
        assertThat(store.selection("ancestry")).isEmpty();
    }

    @Test
    @DisplayName("Recorded selections are copies of the caller's list")
    void defensiveCopy() {
        List<String> values = new ArrayList<>(List.of("sword"));
        store.select("weapon", values);
        values.add("axe");

        assertThat(store.selection("weapon")).containsExactly("sword");
    }

    @Test
    @DisplayName("Snapshots restore into an equal store")
    void snapshotRoundTrip() {
        store.select("weapon", List.of("sword"));
        store.setToggle("rage", true);

        ChoiceSnapshot snapshot = store.snapshot();
        InMemoryChoiceStore restored = InMemoryChoiceStore.from(snapshot);

        assertThat(restored.selection("weapon")).containsExactly("sword");
        assertThat(restored.toggle("rage")).hasValue(true);
        assertThat(restored.toggle("stance")).isEmpty();
    }

    @Test
    @DisplayName("Readers never see a partially written store")
    void concurrentReaders() throws InterruptedException {
        ExecutorService executor = Executors.newFixedThreadPool(4);
        CountDownLatch done = new CountDownLatch(3);
        List<Throwable> failures = new ArrayList<>();

        executor.submit(() -> {
            for (int i = 0; i < 1_000; i++) {
                store.select("flag-" + (i % 10), List.of("v" + i));
            }
            done.countDown();
        });
        for (int reader = 0; reader < 2; reader++) {
            executor.submit(() -> {
                try {
                    for (int i = 0; i < 1_000; i++) {
                        store.snapshot();
                        store.selection("flag-" + (i % 10));
                    }
                } catch (Throwable t) {
                    synchronized (failures) {
                        failures.add(t);
                    }
                }
                done.countDown();
            });
        }

        assertThat(done.await(10, TimeUnit.SECONDS)).isTrue();
        executor.shutdown();
        assertThat(failures).isEmpty();
        assertThat(store.snapshot().selections()).hasSize(10);
    }
}
