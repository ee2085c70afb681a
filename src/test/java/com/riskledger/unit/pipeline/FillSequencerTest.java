package com.riskledger.unit.pipeline;

import static org.assertj.core.api.Assertions.assertThat;

import com.riskledger.pipeline.FillSequencer;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class FillSequencerTest {

    private ExecutorService executor;
    private FillSequencer sequencer;

    @BeforeEach
    void setUp() {
        executor = Executors.newFixedThreadPool(4);
        sequencer = new FillSequencer(executor);
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    @Test
    @DisplayName("Tasks of one session run in submission order")
    void sameSession_ordered() throws Exception {
        List<Integer> applied = new CopyOnWriteArrayList<>();
        CompletableFuture<Void> last = null;
        for (int i = 0; i < 50; i++) {
            int index = i;
            last = sequencer.submit("s1", () -> {
                if (index % 7 == 0) {
                    sleepQuietly(2);
                }
                applied.add(index);
            });
        }

        last.get(5, TimeUnit.SECONDS);

        assertThat(applied).hasSize(50).isSorted();
    }

    @Test
    @DisplayName("A failing task does not block later tasks of the session")
    void failure_doesNotBreakChain() throws Exception {
        List<String> applied = new CopyOnWriteArrayList<>();
        CompletableFuture<Void> failing = sequencer.submit("s1", () -> {
            throw new IllegalStateException("boom");
        });
        CompletableFuture<Void> next = sequencer.submit("s1", () -> applied.add("after"));

        next.get(5, TimeUnit.SECONDS);

        assertThat(failing).isCompletedExceptionally();
        assertThat(applied).containsExactly("after");
    }

    @Test
    @DisplayName("Different sessions run concurrently")
    void differentSessions_concurrent() throws Exception {
        CountDownLatch bothStarted = new CountDownLatch(2);
        Runnable waitForOther = () -> {
            bothStarted.countDown();
            try {
                bothStarted.await(5, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        };

        CompletableFuture<Void> first = sequencer.submit("s1", waitForOther);
        CompletableFuture<Void> second = sequencer.submit("s2", waitForOther);
        CompletableFuture.allOf(first, second).get(5, TimeUnit.SECONDS);

        assertThat(bothStarted.getCount()).isZero();
    }

    private static void sleepQuietly(long millis) {
        try {
            Thread.sleep(millis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
