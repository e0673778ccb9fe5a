package com.sitemapper.core.crawler;

import com.sitemapper.core.api.IBodyFetcher;
import com.sitemapper.core.api.ICrawler;
import com.sitemapper.core.api.IStatusProber;
import com.sitemapper.core.http.HttpBodyFetcher;
import com.sitemapper.core.http.HttpStatusProber;
import com.sitemapper.core.http.HttpSupport;
import com.sitemapper.core.model.CrawlConfig;
import com.sitemapper.core.model.CrawlStats;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.net.http.HttpClient;
import java.util.Objects;

/**
 * 루트 URL 의 같은 호스트 페이지를 전부 방문하는 크롤러.
 * - 중복 방지: 정규화 경로 기준 SeenSet, 디스패치 전에 선점
 * - 깊이 제한: maxDepth 이하(0 이하면 무제한)
 * - 완료 감지: 미완료 카운터가 0 이 되면 sink.complete()
 */
public class SiteCrawler implements ICrawler {

    private static final Logger LOG = LoggerFactory.getLogger(SiteCrawler.class);

    private final IStatusProber prober;
    private final IBodyFetcher fetcher;
    private final LinkExtractor extractor;
    private final boolean verbose;

    /** 기본 구현: HttpClient 하나를 prober/fetcher 가 공유 */
    public SiteCrawler(CrawlConfig config) {
        this(config, HttpSupport.newClient(config));
    }

    public SiteCrawler(CrawlConfig config, HttpClient client) {
        this(new HttpStatusProber(client, config.getTimeout(), config.getUserAgent()),
             new HttpBodyFetcher(client, config.getTimeout(), config.getUserAgent()),
             new JsoupLinkExtractor(),
             config.isVerbose());
    }

    /** DI/테스트용 */
    public SiteCrawler(IStatusProber prober, IBodyFetcher fetcher, LinkExtractor extractor, boolean verbose) {
        this.prober = Objects.requireNonNull(prober, "prober");
        this.fetcher = Objects.requireNonNull(fetcher, "fetcher");
        this.extractor = Objects.requireNonNull(extractor, "extractor");
        this.verbose = verbose;
    }

    @Override
    public CrawlStats crawl(URI root, int maxDepth, WorkerPool pool, ReportSink sink, CancellationSignal cancel) {
        Objects.requireNonNull(pool, "pool");
        CrawlRun run = start(root, maxDepth, pool, sink, cancel);
        return run.stats;
    }

    @Override
    public CrawlStats crawlSerial(URI root, int maxDepth, ReportSink sink, CancellationSignal cancel) {
        CrawlRun run = start(root, maxDepth, null, sink, cancel);
        CrawlTask next;
        while ((next = run.pollSerial()) != null) {
            next.run();
        }
        return run.stats;
    }

    private CrawlRun start(URI root, int maxDepth, WorkerPool pool, ReportSink sink, CancellationSignal cancel) {
        requireCrawlableRoot(root);
        Objects.requireNonNull(sink, "sink");
        Objects.requireNonNull(cancel, "cancel");

        LOG.info("Crawl start: root={}, maxDepth={}, mode={}",
                root, maxDepth > 0 ? maxDepth : "unbounded", pool == null ? "serial" : "pooled");

        CrawlRun run = new CrawlRun(root, maxDepth, verbose, cancel,
                prober, fetcher, extractor, sink, pool, new CrawlStats());
        run.dispatch(new CrawlTask(run, root, 0, null));
        return run;
    }

    private static void requireCrawlableRoot(URI root) {
        Objects.requireNonNull(root, "root");
        if (!root.isAbsolute() || root.getHost() == null) {
            throw new IllegalArgumentException("root must be an absolute URL with a host: " + root);
        }
    }
}
