package com.sitemapper.core.crawler;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.assertTrue;

class BoundedWorkerPoolTest {

    @Test
    void concurrent_adds_never_exceed_max_workers() throws Exception {
        final int MAX = 3;
        final int TASKS = 24;

        BoundedWorkerPool pool = new BoundedWorkerPool(MAX);
        AtomicInteger running = new AtomicInteger();
        AtomicInteger maxRunning = new AtomicInteger();
        AtomicInteger maxSpawned = new AtomicInteger();
        CountDownLatch done = new CountDownLatch(TASKS);

        ExecutorService submitters = Executors.newFixedThreadPool(8);
        try {
            List<Future<Boolean>> accepted = new ArrayList<>();
            for (int i = 0; i < TASKS; i++) {
                accepted.add(submitters.submit(() -> pool.add(() -> {
                    maxRunning.accumulateAndGet(running.incrementAndGet(), Math::max);
                    maxSpawned.accumulateAndGet(pool.spawnedWorkers(), Math::max);
                    try {
                        Thread.sleep(30);
                    } catch (InterruptedException e) {
                        Thread.currentThread().interrupt();
                    } finally {
                        running.decrementAndGet();
                        done.countDown();
                    }
                })));
            }
            for (Future<Boolean> f : accepted) {
                assertThat(f.get(10, TimeUnit.SECONDS)).isTrue();
            }
            assertTrue(done.await(10, TimeUnit.SECONDS), "all tasks should run");
        } finally {
            submitters.shutdownNow();
            pool.stop();
        }

        assertThat(maxRunning.get()).isBetween(1, MAX);
        assertThat(maxSpawned.get()).isLessThanOrEqualTo(MAX);
        assertThat(pool.spawnedWorkers()).isZero();
    }

    @Test
    void add_after_stop_is_dropped() {
        BoundedWorkerPool pool = new BoundedWorkerPool(2);
        pool.stop();
        pool.stop(); // 멱등

        AtomicBoolean ran = new AtomicBoolean();
        assertThat(pool.add(() -> ran.set(true))).isFalse();
        assertThat(ran).isFalse();
    }

    @Test
    void cancellation_releases_an_add_blocked_on_a_saturated_pool() throws Exception {
        CancellationSignal cancel = new CancellationSignal();
        BoundedWorkerPool pool = new BoundedWorkerPool(1, cancel);
        CountDownLatch release = new CountDownLatch(1);
        CountDownLatch started = new CountDownLatch(1);

        assertThat(pool.add(() -> {
            started.countDown();
            try {
                release.await();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        })).isTrue();
        assertTrue(started.await(5, TimeUnit.SECONDS));

        ExecutorService caller = Executors.newSingleThreadExecutor();
        try {
            Future<Boolean> blocked = caller.submit(() -> pool.add(() -> { }));
            Thread.sleep(150);
            assertThat(blocked).isNotDone();   // 워커가 하나뿐이라 대기 중

            cancel.cancel();
            assertThat(blocked.get(2, TimeUnit.SECONDS)).isFalse();
        } finally {
            release.countDown();
            caller.shutdownNow();
            pool.stop();
        }
    }

    @Test
    void stop_waits_for_running_task_and_wakes_waiters() throws Exception {
        BoundedWorkerPool pool = new BoundedWorkerPool(2);
        AtomicBoolean finished = new AtomicBoolean();
        CountDownLatch started = new CountDownLatch(1);

        pool.add(() -> {
            started.countDown();
            try {
                Thread.sleep(200);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            finished.set(true);
        });
        assertTrue(started.await(5, TimeUnit.SECONDS));

        CountDownLatch waited = new CountDownLatch(1);
        Thread waiter = new Thread(() -> {
            try {
                pool.waitOnStop();
                waited.countDown();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }, "waiter");
        waiter.start();

        pool.stop();
        assertThat(finished).isTrue();
        assertTrue(waited.await(5, TimeUnit.SECONDS), "waitOnStop should return after stop");
    }

    @Test
    void failing_task_does_not_kill_the_worker() throws Exception {
        BoundedWorkerPool pool = new BoundedWorkerPool(1);
        CountDownLatch ok = new CountDownLatch(1);
        try {
            pool.add(() -> { throw new IllegalStateException("boom"); });
            pool.add(ok::countDown);
            assertTrue(ok.await(5, TimeUnit.SECONDS));
            assertThat(pool.spawnedWorkers()).isEqualTo(1);
        } finally {
            pool.stop();
        }
    }

    @Test
    void workers_are_named() throws Exception {
        BoundedWorkerPool pool = new BoundedWorkerPool(1);
        String[] name = new String[1];
        CountDownLatch seen = new CountDownLatch(1);
        try {
            pool.add(() -> {
                name[0] = Thread.currentThread().getName();
                seen.countDown();
            });
            assertTrue(seen.await(5, TimeUnit.SECONDS));
        } finally {
            pool.stop();
        }
        assertThat(name[0]).startsWith("crawl-worker-");
    }

    @Test
    void max_must_be_positive() {
        assertThatThrownBy(() -> new BoundedWorkerPool(0))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
