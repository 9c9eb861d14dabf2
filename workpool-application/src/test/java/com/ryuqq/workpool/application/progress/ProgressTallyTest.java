package com.ryuqq.workpool.application.progress;

import com.ryuqq.workpool.adapter.inmemory.channel.InMemoryChannel;
import com.ryuqq.workpool.core.progress.Progress;
import org.junit.jupiter.api.Test;
import org.slf4j.helpers.NOPLogger;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

/**
 * ProgressTally 테스트.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
class ProgressTallyTest {

    @Test
    void UPDATE는_누적되고_ESTIMATE는_최신값만_남는다() {
        // given
        ProgressTally tally = new ProgressTally();

        // when
        tally.record(Progress.estimate(10));
        tally.record(Progress.update(3));
        tally.record(Progress.update(2));
        tally.record(Progress.estimate(20));
        tally.record(Progress.update(-1));
        tally.record(Progress.messagef("ignored"));

        // then
        assertThat(tally.completed()).isEqualTo(4);
        assertThat(tally.estimate()).isEqualTo(20);
        assertThat(tally.fraction()).isCloseTo(0.2, within(1e-9));
    }

    @Test
    void 추정치가_없으면_진행률은_0() {
        // given
        ProgressTally tally = new ProgressTally();

        // when
        tally.record(Progress.update(5));

        // then
        assertThat(tally.fraction()).isZero();
    }

    @Test
    void 진행률은_1을_넘지_않는다() {
        // given
        ProgressTally tally = new ProgressTally();

        // when
        tally.record(Progress.estimate(2));
        tally.record(Progress.update(3));

        // then
        assertThat(tally.fraction()).isEqualTo(1.0);
    }

    @Test
    void ProgressLogger_forwarding과_연결된다() throws Exception {
        // given
        ExecutorService executorService = Executors.newFixedThreadPool(2);
        InMemoryChannel<Progress> source = new InMemoryChannel<>();
        InMemoryChannel<Progress> bar = new InMemoryChannel<>();
        ProgressTally tally = new ProgressTally();
        ProgressLogger sink = new ProgressLogger(NOPLogger.NOP_LOGGER, false)
            .withForwarding(bar);

        try {
            // when
            CompletableFuture<Void> tallyDone = tally.start(bar, executorService);
            CompletableFuture<Void> sinkDone = sink.start(source, executorService);
            source.send(Progress.estimate(4));
            for (int i = 0; i < 4; i++) {
                source.send(Progress.update(1));
            }
            source.close();
            sinkDone.get(5, TimeUnit.SECONDS);
            bar.close();
            tallyDone.get(5, TimeUnit.SECONDS);

            // then
            assertThat(tally.completed()).isEqualTo(4);
            assertThat(tally.estimate()).isEqualTo(4);
            assertThat(tally.fraction()).isEqualTo(1.0);
        } finally {
            executorService.shutdownNow();
        }
    }
}
