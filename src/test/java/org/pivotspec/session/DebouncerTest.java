package org.pivotspec.session;

import static org.assertj.core.api.Assertions.assertThat;
import static org.awaitility.Awaitility.await;

import java.time.Duration;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

@Tag("unit")
@DisplayName("Debouncer")
class DebouncerTest {

    @Test
    @DisplayName("The debouncer runs only the last action of a burst")
    void debouncer() throws Exception {
        ScheduledExecutorService loop = Executors.newSingleThreadScheduledExecutor();
        try {
            Debouncer debouncer = new Debouncer(loop, Duration.ofMillis(300));
            AtomicInteger first = new AtomicInteger();
            AtomicInteger last = new AtomicInteger();

            loop.submit(() -> debouncer.trigger(first::incrementAndGet)).get(1, TimeUnit.SECONDS);
            loop.submit(() -> debouncer.trigger(last::incrementAndGet)).get(1, TimeUnit.SECONDS);

            await().atMost(Duration.ofSeconds(5)).until(() -> last.get() == 1);
            assertThat(first.get()).isZero();
            assertThat(loop.submit(debouncer::isPending).get(1, TimeUnit.SECONDS)).isFalse();
        } finally {
            loop.shutdownNow();
        }
    }

    @Test
    @DisplayName("A cancelled action never runs")
    void cancel() throws Exception {
        ScheduledExecutorService loop = Executors.newSingleThreadScheduledExecutor();
        try {
            Debouncer debouncer = new Debouncer(loop, Duration.ofMillis(20));
            AtomicInteger runs = new AtomicInteger();

            loop.submit(() -> {
                debouncer.trigger(runs::incrementAndGet);
                debouncer.cancel();
            }).get(1, TimeUnit.SECONDS);
            Thread.sleep(100);

            assertThat(runs.get()).isZero();
        } finally {
            loop.shutdownNow();
        }
    }
}
