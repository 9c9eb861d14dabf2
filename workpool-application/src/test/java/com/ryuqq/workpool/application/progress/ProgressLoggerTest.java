package com.ryuqq.workpool.application.progress;

import com.ryuqq.workpool.adapter.inmemory.channel.InMemoryChannel;
import com.ryuqq.workpool.core.progress.Progress;
import com.ryuqq.workpool.core.progress.ProgressFailure;
import com.ryuqq.workpool.core.progress.ProgressType;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.slf4j.Logger;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoMoreInteractions;

/**
 * ProgressLogger 테스트.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
@ExtendWith(MockitoExtension.class)
@DisplayName("ProgressLogger 테스트")
class ProgressLoggerTest {

    @Mock
    private Logger out;

    private ExecutorService executorService;

    @BeforeEach
    void setUp() {
        executorService = Executors.newSingleThreadExecutor();
    }

    @AfterEach
    void tearDown() {
        executorService.shutdownNow();
    }

    @Test
    void 오류는_기록후_콜백되고_UPDATE와_ESTIMATE만_전달된다() throws Exception {
        // given
        InMemoryChannel<Progress> source = new InMemoryChannel<>(10);
        InMemoryChannel<Progress> bar = new InMemoryChannel<>(10);
        List<Throwable> errors = new ArrayList<>();
        ProgressLogger sink = new ProgressLogger(out, true)
            .withErrorHandler(errors::add)
            .withForwarding(bar);

        source.send(Progress.errorf("boom"));
        source.send(Progress.messagef("hello"));
        source.send(Progress.estimate(10));
        source.send(Progress.update(3));
        source.close();

        // when
        sink.run(source);

        // then
        assertThat(errors).containsExactly(new ProgressFailure("boom"));
        bar.close();
        assertThat(bar.receive()).contains(Progress.estimate(10));
        assertThat(bar.receive()).contains(Progress.update(3));
        assertThat(bar.receive()).isEmpty();

        InOrder order = inOrder(out);
        order.verify(out).error("[PROGRESS] ERROR: {}", "boom");
        order.verify(out).info("[PROGRESS] {}", "hello");
        order.verify(out).info("[PROGRESS] {}: {}", "ProgressEstimate", 10L);
        order.verify(out).info("[PROGRESS] {}: {}", "ProgressUpdate", 3L);
        verifyNoMoreInteractions(out);
    }

    @Test
    void logMessages가_false면_오류만_기록되고_전달은_유지된다() throws Exception {
        // given
        InMemoryChannel<Progress> bar = new InMemoryChannel<>(4);
        ProgressLogger sink = new ProgressLogger(out, false).withForwarding(bar);

        // when
        sink.accept(Progress.messagef("quiet"));
        sink.accept(Progress.update(1));
        sink.accept(Progress.errorf("still %s", "loud"));

        // then
        verify(out).error("[PROGRESS] ERROR: {}", "still loud");
        verifyNoMoreInteractions(out);
        assertThat(bar.size()).isEqualTo(1);
        assertThat(bar.receive()).contains(Progress.update(1));
    }

    @Test
    void 알수없는_태그와_OTHER는_경고로_기록된다() throws Exception {
        // given
        ProgressLogger sink = new ProgressLogger(out, false);

        // when
        sink.accept(Progress.of(ProgressType.of(1024), "CRAP!"));
        sink.accept(Progress.other("opaque"));

        // then
        verify(out).warn("[PROGRESS] ??: {}", ": CRAP!");
        verify(out).warn("[PROGRESS] ??: {}", "ProgressOther: opaque");
        verifyNoMoreInteractions(out);
    }

    @Test
    void 콜백이_없어도_오류는_기록된다() throws Exception {
        // given
        ProgressLogger sink = new ProgressLogger(out, true);

        // when
        sink.accept(Progress.error(new IllegalStateException("disk full")));

        // then
        verify(out).error("[PROGRESS] ERROR: {}", "disk full");
    }

    @Test
    void 읽는쪽이_닫은_forwarding_채널은_이후_생략된다() throws Exception {
        // given
        InMemoryChannel<Progress> bar = new InMemoryChannel<>();
        bar.close();
        ProgressLogger sink = new ProgressLogger(out, true).withForwarding(bar);

        // when
        sink.accept(Progress.update(1));
        sink.accept(Progress.update(2));

        // then
        verify(out).info("[PROGRESS] {}: {}", "ProgressUpdate", 1L);
        verify(out).info("[PROGRESS] {}: {}", "ProgressUpdate", 2L);
        assertThat(bar.size()).isZero();
    }

    @Test
    void start는_source가_닫히면_완료된다() throws Exception {
        // given
        InMemoryChannel<Progress> source = new InMemoryChannel<>();
        ProgressLogger sink = new ProgressLogger(out, true);

        // when
        CompletableFuture<Void> done = sink.start(source, executorService);
        source.send(Progress.messagef("one"));
        source.send(Progress.messagef("two"));
        source.close();

        // then
        done.get(5, TimeUnit.SECONDS);
        verify(out).info("[PROGRESS] {}", "one");
        verify(out).info("[PROGRESS] {}", "two");
    }

    @Test
    void 콜백의_예외는_start_future로_전파된다() throws Exception {
        // given
        InMemoryChannel<Progress> source = new InMemoryChannel<>(2);
        ProgressLogger sink = new ProgressLogger(out, false)
            .withErrorHandler(error -> {
                throw new IllegalStateException("abort: " + error.getMessage());
            });
        source.send(Progress.errorf("fatal"));
        source.close();

        // when
        CompletableFuture<Void> done = sink.start(source, executorService);

        // then
        assertThatThrownBy(() -> done.get(5, TimeUnit.SECONDS))
            .hasCauseInstanceOf(IllegalStateException.class)
            .hasMessageContaining("abort: fatal");
    }

    @Test
    void 인자_검증() {
        assertThatThrownBy(() -> new ProgressLogger(null, true))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessage("out cannot be null");

        ProgressLogger sink = new ProgressLogger(out, true);
        assertThatThrownBy(() -> sink.run(null))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> sink.start(new InMemoryChannel<>(), null))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessage("executor cannot be null");
    }
}
