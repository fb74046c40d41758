package io.pipingrelay.core.transfer;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.pipingrelay.core.error.TransferAbortedException;
import java.io.IOException;
import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.Test;

/** Tests for {@link Handoff}. */
class HandoffTest {

    @Test
    void deliversOfferedValueOnce() throws Exception {
        var handoff = new Handoff<String>();

        assertThat(handoff.offer("hello")).isTrue();

        assertThat(handoff.receive()).hasValue("hello");
        assertThat(handoff.receive()).isEmpty();
        assertThat(handoff.delivered()).hasValue("hello");
    }

    @Test
    void receiveBlocksUntilOffered() throws Exception {
        var handoff = new Handoff<String>();
        CompletableFuture<Optional<String>> received = CompletableFuture.supplyAsync(() -> {
            try {
                return handoff.receive();
            } catch (IOException | InterruptedException e) {
                throw new IllegalStateException(e);
            }
        });

        Thread.sleep(50);
        assertThat(received).isNotDone();

        handoff.offer("late");
        assertThat(received.get(5, TimeUnit.SECONDS)).hasValue("late");
    }

    @Test
    void awaitTimesOutWithoutConsumingTheValue() throws Exception {
        var handoff = new Handoff<String>();

        assertThat(handoff.await(Duration.ofMillis(20))).isFalse();

        handoff.offer("value");
        assertThat(handoff.await(Duration.ofMillis(20))).isTrue();
        assertThat(handoff.receive()).hasValue("value");
    }

    @Test
    void awaitReturnsOnAbort() throws Exception {
        var handoff = new Handoff<String>();
        handoff.abort(new IOException("gone"));

        assertThat(handoff.await(Duration.ofSeconds(5))).isTrue();
        assertThatThrownBy(handoff::receive).isInstanceOf(TransferAbortedException.class);
    }

    @Test
    void secondOfferThrows() {
        var handoff = new Handoff<String>();
        handoff.offer("a");

        assertThatThrownBy(() -> handoff.offer("b"))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("already used");
    }

    @Test
    void nullOfferThrows() {
        assertThatThrownBy(() -> new Handoff<String>().offer(null)).isInstanceOf(NullPointerException.class);
    }

    @Test
    void abortFailsReceiverAndRefusesLaterOffer() {
        var handoff = new Handoff<String>();
        var cause = new IOException("gone");

        assertThat(handoff.abort(cause)).isTrue();

        assertThat(handoff.offer("too late")).isFalse();
        assertThat(handoff.isAborted()).isTrue();
        assertThat(handoff.delivered()).isEmpty();
        assertThatThrownBy(handoff::receive)
                .isInstanceOf(TransferAbortedException.class)
                .hasCause(cause);
    }

    @Test
    void abortAfterDeliveryHasNoEffect() throws Exception {
        var handoff = new Handoff<String>();
        handoff.offer("kept");

        assertThat(handoff.abort(new IOException("ignored"))).isFalse();
        assertThat(handoff.isAborted()).isFalse();
        assertThat(handoff.isDone()).isTrue();
        assertThat(handoff.receive()).hasValue("kept");
    }
}
