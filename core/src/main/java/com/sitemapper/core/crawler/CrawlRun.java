package com.sitemapper.core.crawler;

import com.sitemapper.core.api.IBodyFetcher;
import com.sitemapper.core.api.IStatusProber;
import com.sitemapper.core.model.CrawlStats;
import com.sitemapper.core.model.LinkReport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;

/**
 * 런 하나의 공유 핸들: seen set, 미완료 카운터, 취소 신호, 협력 객체들.
 * 런 시작 시 만들어지고 런 도중 리셋되지 않는다.
 *
 * 자식 제출 경로:
 *  - 풀 모드: 런 전용 디스패처 스레드가 pool.add 를 대신 호출한다.
 *    워커가 포화된 풀에 스스로 제출하다 전원 블록되는 교착을 막기 위함.
 *    디스패처 큐는 무제한이다. 풀이 포화되면 claim 전 자식 태스크가
 *    (같은 경로 중복 포함) 메모리에 쌓인다.
 *  - 직렬 모드: 호출 스레드가 비우는 로컬 deque.
 */
final class CrawlRun {

    private static final Logger LOG = LoggerFactory.getLogger(CrawlRun.class);

    final URI root;
    final int maxDepth;
    final boolean verbose;
    final SeenSet seen = new SeenSet();
    final CancellationSignal cancel;
    final IStatusProber prober;
    final IBodyFetcher fetcher;
    final BodyCrawler bodyCrawler;
    final CrawlStats stats;
    final OutstandingWork outstanding;

    private final ReportSink sink;
    private final WorkerPool pool;                  // null = 직렬 모드
    private final ExecutorService dispatcher;       // 풀 모드 전용
    private final Deque<CrawlTask> serialQueue;     // 직렬 모드 전용 (호출 스레드만 접근)

    CrawlRun(URI root, int maxDepth, boolean verbose, CancellationSignal cancel,
             IStatusProber prober, IBodyFetcher fetcher, LinkExtractor extractor,
             ReportSink sink, WorkerPool pool, CrawlStats stats) {
        this.root = root;
        this.maxDepth = maxDepth;
        this.verbose = verbose;
        this.cancel = cancel;
        this.stats = stats;
        // probe 횟수 집계
        this.prober = (url, c) -> {
            stats.probed();
            return prober.probe(url, c);
        };
        this.fetcher = fetcher;
        this.bodyCrawler = new BodyCrawler(extractor, this.prober);
        this.sink = sink;
        this.pool = pool;
        this.dispatcher = (pool == null) ? null
                : Executors.newSingleThreadExecutor(new NamedThreadFactory("crawl-dispatch"));
        this.serialQueue = (pool == null) ? new ArrayDeque<>() : null;
        this.outstanding = new OutstandingWork(this::finish);
    }

    boolean depthBounded() { return maxDepth > 0; }

    void emit(LinkReport report) {
        sink.emit(report);
        stats.reportEmitted();
    }

    /** 카운터 증가 후 제출. 제출이 거절되면 즉시 감소시켜 런이 멈추지 않게 한다. */
    void dispatch(CrawlTask task) {
        outstanding.increment();
        if (pool == null) {
            serialQueue.addLast(task);
            stats.dispatched();
            return;
        }
        try {
            dispatcher.execute(() -> handOff(task));
        } catch (RejectedExecutionException e) {
            dropped(task);
        }
    }

    /** 직렬 모드: 다음 작업 (없으면 null) */
    CrawlTask pollSerial() {
        return serialQueue.pollFirst();
    }

    private void handOff(CrawlTask task) {
        boolean accepted;
        try {
            accepted = pool.add(task);
        } catch (RuntimeException e) {
            LOG.warn("pool rejected {}", task.target(), e);
            accepted = false;
        }
        if (accepted) stats.dispatched();
        else dropped(task);
    }

    private void dropped(CrawlTask task) {
        stats.rejected();
        if (!cancel.isCancelled()) {
            LOG.warn("Dispatch dropped (pool stopped): {}", task.target());
        }
        outstanding.done();
    }

    /** 카운터가 0이 되는 순간 한 번만 호출된다. */
    private void finish() {
        try {
            sink.complete();
        } finally {
            if (dispatcher != null) dispatcher.shutdown();
            CrawlStats.Snapshot s = stats.snapshot();
            LOG.info("Crawl done: root={}, reports={}, dispatched={}, dropped={}, cancelled={}",
                    root, s.reportsEmitted, s.dispatched, s.rejected, cancel.isCancelled());
        }
    }
}
