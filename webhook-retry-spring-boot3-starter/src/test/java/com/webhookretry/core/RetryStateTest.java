package com.webhookretry.core;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RetryStateTest {

    private final RetryState state = new RetryState();

    @Test
    void takeAndClear_AfterSet_ReturnsOnce() {
        state.set("slack#1", Duration.ofSeconds(2));

        assertThat(state.takeAndClear("slack#1")).contains(Duration.ofSeconds(2));
        assertThat(state.takeAndClear("slack#1")).isEmpty();
        assertThat(state.isEmpty()).isTrue();
    }

    @Test
    void set_Twice_LastWriteWins() {
        state.set("slack#1", Duration.ofSeconds(2));
        state.set("slack#1", Duration.ofSeconds(5));

        assertThat(state.peek("slack#1")).contains(Duration.ofSeconds(5));
        assertThat(state.takeAndClear("slack#1")).contains(Duration.ofSeconds(5));
    }

    @Test
    void takeAndClear_OtherId_Untouched() {
        state.set("a", Duration.ofSeconds(1));
        state.set("b", Duration.ofSeconds(3));

        assertThat(state.takeAndClear("a")).contains(Duration.ofSeconds(1));
        assertThat(state.peek("b")).contains(Duration.ofSeconds(3));
    }

    @Test
    void set_NegativeDelay_ThrowsException() {
        assertThatThrownBy(() -> state.set("a", Duration.ofSeconds(-1)))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void takeAndClear_Concurrent_ExactlyOneWinner() throws Exception {
        state.set("a", Duration.ofSeconds(1));
        int threads = 8;
        ExecutorService pool = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        try {
            List<Future<Optional<Duration>>> results = new ArrayList<>();
            for (int i = 0; i < threads; i++) {
                results.add(pool.submit(() -> {
                    start.await();
                    return state.takeAndClear("a");
                }));
            }
            start.countDown();

            int present = 0;
            for (Future<Optional<Duration>> f : results) {
                if (f.get(5, TimeUnit.SECONDS).isPresent()) {
                    present++;
                }
            }
            assertThat(present).isEqualTo(1);
        } finally {
            pool.shutdownNow();
        }
    }
}
