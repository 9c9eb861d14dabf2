package com.ryuqq.workpool.core.limiter;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

/**
 * SemaphoreAdmissionLimiter 유닛 테스트.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
@DisplayName("SemaphoreAdmissionLimiter 테스트")
class SemaphoreAdmissionLimiterTest {

    @Test
    @DisplayName("maxConcurrency 만큼만 슬롯을 내준다")
    void tryAcquire_용량까지만_성공() {
        // given
        AdmissionLimiter limiter = new SemaphoreAdmissionLimiter(new AdmissionConfig(2));

        // when & then
        assertTrue(limiter.tryAcquire());
        assertTrue(limiter.tryAcquire());
        assertFalse(limiter.tryAcquire());
        assertEquals(2, limiter.getCurrentConcurrency());
    }

    @Test
    @DisplayName("반납된 슬롯은 다시 획득할 수 있다")
    void release_후_재획득() throws InterruptedException {
        // given
        AdmissionLimiter limiter = new SemaphoreAdmissionLimiter(new AdmissionConfig(1));
        assertTrue(limiter.tryAcquire(10));

        // when
        limiter.release();

        // then
        assertEquals(0, limiter.getCurrentConcurrency());
        assertTrue(limiter.tryAcquire(10));
    }

    @Test
    @DisplayName("슬롯이 없으면 timeout 후 false를 반환한다")
    void tryAcquireWithTimeout_타임아웃() throws InterruptedException {
        // given
        AdmissionLimiter limiter = new SemaphoreAdmissionLimiter(new AdmissionConfig(1));
        limiter.tryAcquire();

        // when
        long start = System.nanoTime();
        boolean acquired = limiter.tryAcquire(30);
        long elapsedMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start);

        // then
        assertFalse(acquired);
        assertTrue(elapsedMs >= 25, "waited " + elapsedMs + "ms");
    }

    @Test
    @DisplayName("획득하지 않은 슬롯 반납은 IllegalStateException")
    void release_획득_없이_호출시_예외() {
        // given
        AdmissionLimiter limiter = new SemaphoreAdmissionLimiter(new AdmissionConfig(3));

        // when & then
        assertThrows(IllegalStateException.class, limiter::release);
        assertEquals(0, limiter.getCurrentConcurrency());
        assertEquals(3, limiter.getConfig().maxConcurrency());
    }

    @Test
    @DisplayName("여러 스레드가 경쟁해도 동시 보유 수는 용량을 넘지 않는다")
    void 동시_획득_경쟁시_용량_유지() throws Exception {
        // given
        int capacity = 3;
        AdmissionLimiter limiter = new SemaphoreAdmissionLimiter(new AdmissionConfig(capacity));
        AtomicInteger holding = new AtomicInteger();
        AtomicInteger maxHolding = new AtomicInteger();
        CountDownLatch start = new CountDownLatch(1);
        ExecutorService executorService = Executors.newFixedThreadPool(10);
        List<Future<?>> futures = new ArrayList<>();

        // when
        for (int i = 0; i < 10; i++) {
            futures.add(executorService.submit(() -> {
                start.await();
                for (int round = 0; round < 20; round++) {
                    if (limiter.tryAcquire(50)) {
                        try {
                            maxHolding.accumulateAndGet(holding.incrementAndGet(), Math::max);
                            Thread.sleep(1);
                        } finally {
                            holding.decrementAndGet();
                            limiter.release();
                        }
                    }
                }
                return null;
            }));
        }
        start.countDown();
        for (Future<?> future : futures) {
            future.get(10, TimeUnit.SECONDS);
        }
        executorService.shutdown();

        // then
        assertTrue(maxHolding.get() <= capacity);
        assertEquals(0, limiter.getCurrentConcurrency());
    }

    @Test
    @DisplayName("config가 null이면 IllegalArgumentException")
    void 생성자_null_config() {
        assertThrows(IllegalArgumentException.class, () -> new SemaphoreAdmissionLimiter(null));
    }
}
