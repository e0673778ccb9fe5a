package com.sitemapper.core.crawler;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.concurrent.SynchronousQueue;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;

/**
 * 워커를 필요할 때 max 까지 늘리는 풀.
 * - 대기 중인 워커가 있으면 SynchronousQueue 로 바로 넘긴다
 * - 없고 max 미만이면 워커 하나 추가 (판단과 증가는 한 임계구역 안에서)
 * - 그래도 없으면 랑데부에서 블록: 워커가 비거나, 정지/취소될 때까지
 */
public final class BoundedWorkerPool implements WorkerPool {

    private static final Logger LOG = LoggerFactory.getLogger(BoundedWorkerPool.class);

    /** 정지/취소 확인 주기 */
    private static final long POLL_MS = 50;

    private final int max;
    private final CancellationSignal cancel;
    private final ThreadFactory threadFactory;
    private final SynchronousQueue<Runnable> intake = new SynchronousQueue<>();

    private final Object lock = new Object();
    private int spawned;              // guarded by lock
    private boolean stopping;         // guarded by lock
    private boolean stopped;          // guarded by lock: 워커 전부 종료됨
    private volatile boolean closed;  // intake 닫힘(락 없이 읽는 빠른 경로)

    public BoundedWorkerPool(int max) {
        this(max, new CancellationSignal());
    }

    public BoundedWorkerPool(int max, CancellationSignal cancel) {
        this(max, cancel, new NamedThreadFactory("crawl-worker"));
    }

    BoundedWorkerPool(int max, CancellationSignal cancel, ThreadFactory threadFactory) {
        if (max < 1) throw new IllegalArgumentException("max must be >= 1");
        this.max = max;
        this.cancel = Objects.requireNonNull(cancel, "cancel");
        this.threadFactory = Objects.requireNonNull(threadFactory, "threadFactory");
    }

    @Override
    public boolean add(Runnable task) {
        Objects.requireNonNull(task, "task");
        if (intakeClosed()) return false;

        // 1) 놀고 있는 워커에 직접 전달
        if (intake.offer(task)) return true;

        // 2) max 미만이면 워커 추가 (read-then-act 경쟁 방지: 같은 락 안에서 판단+증가)
        synchronized (lock) {
            if (stopping) return false;
            if (spawned < max) {
                spawned++;
                try {
                    threadFactory.newThread(() -> work(task)).start();
                } catch (RuntimeException e) {
                    spawned--;
                    lock.notifyAll();
                    throw e;
                }
                return true;
            }
        }

        // 3) 포화: 워커가 빌 때까지 랑데부 대기
        try {
            while (!intakeClosed()) {
                if (intake.offer(task, POLL_MS, TimeUnit.MILLISECONDS)) return true;
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        return false;
    }

    @Override
    public void stop() {
        boolean interrupted = false;
        synchronized (lock) {
            stopping = true;
            closed = true;
            while (spawned > 0) {
                try {
                    lock.wait();
                } catch (InterruptedException e) {
                    interrupted = true;
                }
            }
            stopped = true;
            lock.notifyAll();
        }
        if (interrupted) Thread.currentThread().interrupt();
        LOG.debug("worker pool stopped");
    }

    @Override
    public void waitOnStop() throws InterruptedException {
        synchronized (lock) {
            while (!stopped) lock.wait();
        }
    }

    /** 현재 살아 있는 워커 수 */
    public int spawnedWorkers() {
        synchronized (lock) {
            return spawned;
        }
    }

    public int maxWorkers() { return max; }

    private boolean intakeClosed() {
        return closed || cancel.isCancelled();
    }

    private void work(Runnable first) {
        try {
            runSafely(first);
            while (!intakeClosed()) {
                Runnable next = intake.poll(POLL_MS, TimeUnit.MILLISECONDS);
                if (next != null) runSafely(next);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } finally {
            synchronized (lock) {
                spawned--;
                lock.notifyAll();
            }
        }
    }

    private static void runSafely(Runnable r) {
        try {
            r.run();
        } catch (RuntimeException e) {
            LOG.warn("worker task failed", e);
        }
    }
}
