package org.pivotspec.session;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.concurrent.CompletableFuture;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

@Tag("unit")
@DisplayName("RequestSequencer")
class RequestSequencerTest {

    private final RequestSequencer<RequestKey> sequencer = new RequestSequencer<>();
    private final RequestKey region = new RequestKey("region", "w1", "ds-1");
    private final RequestKey channel = new RequestKey("channel", "w1", "ds-1");

    @Test
    @DisplayName("The latest request wins and the superseded one is cancelled")
    void latestWins() {
        CompletableFuture<String> firstUpstream = new CompletableFuture<>();
        CompletableFuture<String> secondUpstream = new CompletableFuture<>();

        CompletableFuture<String> first = sequencer.submit(region, () -> firstUpstream);
        CompletableFuture<String> second = sequencer.submit(region, () -> secondUpstream);
        firstUpstream.complete("stale");
        secondUpstream.complete("fresh");

        assertThat(first).isCancelled();
        assertThat(second).isCompletedWithValue("fresh");
        assertThat(sequencer.isPending(region)).isFalse();
    }

    @Test
    @DisplayName("Superseding cancels the upstream request")
    void cancelsUpstream() {
        CompletableFuture<String> firstUpstream = new CompletableFuture<>();

        sequencer.submit(region, () -> firstUpstream);
        sequencer.submit(region, CompletableFuture::new);

        assertThat(firstUpstream).isCancelled();
        assertThat(sequencer.isPending(region)).isTrue();
    }

    @Test
    @DisplayName("Requests for different keys do not interfere")
    void independentKeys() {
        CompletableFuture<String> regionUpstream = new CompletableFuture<>();

        CompletableFuture<String> regionResult = sequencer.submit(region, () -> regionUpstream);
        CompletableFuture<String> channelResult =
            sequencer.submit(channel, () -> CompletableFuture.completedFuture("web"));
        regionUpstream.complete("EU");

        assertThat(regionResult).isCompletedWithValue("EU");
        assertThat(channelResult).isCompletedWithValue("web");
    }

    @Test
    @DisplayName("Failures reach the caller")
    void failures() {
        CompletableFuture<String> upstream = new CompletableFuture<>();
        CompletableFuture<String> result = sequencer.submit(region, () -> upstream);

        upstream.completeExceptionally(new IllegalStateException("backend down"));

        assertThat(result).isCompletedExceptionally();
        assertThat(sequencer.submit(channel, () -> {
            throw new IllegalArgumentException("bad request");
        })).isCompletedExceptionally();
    }

    @Test
    @DisplayName("Cancel all cancels every pending request")
    void cancelAll() {
        CompletableFuture<String> regionResult = sequencer.submit(region, CompletableFuture::new);
        CompletableFuture<String> channelResult = sequencer.submit(channel, CompletableFuture::new);

        sequencer.cancelAll();

        assertThat(regionResult).isCancelled();
        assertThat(channelResult).isCancelled();
        assertThat(sequencer.isPending(region)).isFalse();
    }
}
