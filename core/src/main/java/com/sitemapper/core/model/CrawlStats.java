package com.sitemapper.core.model;

import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/** 런 단위 텔레메트리 누적기 (스레드 세이프). */
public final class CrawlStats {
    private final AtomicLong reportsEmitted = new AtomicLong(0);
    private final AtomicLong dispatched     = new AtomicLong(0);   // 풀에 넘긴 자식 노드
    private final AtomicLong rejected       = new AtomicLong(0);   // 풀이 거절(정지/취소)
    private final AtomicLong probes         = new AtomicLong(0);   // HEAD 횟수
    private final AtomicInteger running     = new AtomicInteger(0);
    private final AtomicInteger maxObservedConcurrency = new AtomicInteger(0);

    public void reportEmitted() { reportsEmitted.incrementAndGet(); }
    public void dispatched() { dispatched.incrementAndGet(); }
    public void rejected() { rejected.incrementAndGet(); }
    public void probed() { probes.incrementAndGet(); }

    /** 노드 실행 진입: 동시 실행 수 관측 */
    public void nodeStarted() {
        int cur = running.incrementAndGet();
        maxObservedConcurrency.accumulateAndGet(cur, Math::max);
    }

    public void nodeFinished() { running.decrementAndGet(); }

    public Snapshot snapshot() {
        return new Snapshot(reportsEmitted.get(), dispatched.get(), rejected.get(),
                probes.get(), maxObservedConcurrency.get());
    }

    /** 불변 스냅샷 DTO */
    public static final class Snapshot {
        public final long reportsEmitted;
        public final long dispatched;
        public final long rejected;
        public final long probes;
        public final int  maxObservedConcurrency;
        public Snapshot(long e, long d, long r, long p, int c) {
            this.reportsEmitted = e;
            this.dispatched = d;
            this.rejected = r;
            this.probes = p;
            this.maxObservedConcurrency = c;
        }
    }
}
