package com.sitemapper.core.crawler;

import java.util.Objects;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 디스패치됐지만 끝나지 않은 코디네이터 실행 수.
 * 0 이 되는 마지막 감소가 완료 콜백을 정확히 한 번 실행한다.
 */
final class OutstandingWork {
    private final AtomicInteger count = new AtomicInteger(0);
    private final AtomicBoolean finished = new AtomicBoolean(false);
    private final CountDownLatch zero = new CountDownLatch(1);
    private final Runnable onZero;

    OutstandingWork(Runnable onZero) {
        this.onZero = Objects.requireNonNull(onZero, "onZero");
    }

    void increment() {
        if (finished.get()) throw new IllegalStateException("run already finished");
        count.incrementAndGet();
    }

    void done() {
        int n = count.decrementAndGet();
        if (n < 0) throw new IllegalStateException("outstanding work below zero");
        if (n == 0 && finished.compareAndSet(false, true)) {
            try {
                onZero.run();
            } finally {
                zero.countDown();
            }
        }
    }

    int pending() { return count.get(); }

    boolean isFinished() { return finished.get(); }

    void await() throws InterruptedException { zero.await(); }

    boolean await(long timeout, TimeUnit unit) throws InterruptedException {
        return zero.await(timeout, unit);
    }
}
