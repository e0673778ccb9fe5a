package com.sitemapper.app.cli;

import com.sitemapper.app.logging.LogSetup;
import com.sitemapper.app.render.JsonLinesRenderer;
import com.sitemapper.app.render.ReportRenderer;
import com.sitemapper.app.render.SitemapXmlRenderer;
import com.sitemapper.core.crawler.BoundedWorkerPool;
import com.sitemapper.core.crawler.CancellationSignal;
import com.sitemapper.core.crawler.ReportStream;
import com.sitemapper.core.crawler.SiteCrawler;
import com.sitemapper.core.model.CrawlConfig;
import com.sitemapper.core.util.YamlConfigLoader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.OutputStreamWriter;
import java.io.PrintStream;
import java.io.Writer;
import java.net.URI;
import java.net.URISyntaxException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Duration;

/** CLI 진입점: 인자 → 설정 → 크롤 → 렌더링 */
public final class Main {

    private static final Logger LOG = LoggerFactory.getLogger(Main.class);

    static final int EXIT_OK = 0;
    static final int EXIT_FAILED = 1;
    static final int EXIT_USAGE = 2;

    private final PrintStream out;
    private final PrintStream err;

    Main(PrintStream out, PrintStream err) {
        this.out = out;
        this.err = err;
    }

    public static void main(String[] args) {
        // 로그 초기화 (-Dsm.out.dir 없으면 "out")
        Path outRoot = Path.of(System.getProperty("sm.out.dir", "out"));
        LogSetup.init(outRoot.resolve("logs"));

        int code = new Main(System.out, System.err).run(args);
        System.exit(code);
    }

    int run(String... args) {
        CliOptions opts;
        try {
            opts = CliOptions.parse(args);
        } catch (IllegalArgumentException e) {
            err.println("error: " + e.getMessage());
            err.println(CliOptions.USAGE);
            return EXIT_USAGE;
        }
        if (opts.isHelp()) {
            out.println(CliOptions.USAGE);
            return EXIT_OK;
        }

        CrawlConfig cfg;
        URI root;
        try {
            cfg = resolveConfig(opts);
            root = new URI(cfg.getTarget());
            if (!root.isAbsolute() || root.getHost() == null) {
                throw new IllegalArgumentException("url must be absolute: " + cfg.getTarget());
            }
        } catch (IOException | URISyntaxException | IllegalArgumentException e) {
            err.println("error: " + e.getMessage());
            return EXIT_USAGE;
        }

        long start = System.nanoTime();
        try {
            crawl(cfg, root, rendererFor(opts.getFormat()));
        } catch (IOException e) {
            LOG.error("Crawl output failed", e);
            err.println("error: " + e.getMessage());
            return EXIT_FAILED;
        }

        if (opts.isTimed()) {
            err.printf("%nFinished: %s.%n", Duration.ofNanos(System.nanoTime() - start));
        }
        return EXIT_OK;
    }

    /** crawl.yml(옵션) → CLI 플래그 순으로 덮어쓴다. */
    static CrawlConfig resolveConfig(CliOptions opts) throws IOException {
        CrawlConfig cfg = (opts.getConfig() != null)
                ? YamlConfigLoader.load(opts.getConfig())
                : CrawlConfig.defaults();
        if (opts.getUrl() != null) cfg.setTarget(opts.getUrl());
        if (opts.getDepth() != null) cfg.setMaxDepth(opts.getDepth());
        if (opts.getWorkers() != null) cfg.setWorkers(opts.getWorkers());
        if (opts.getTimeoutMs() != null) cfg.setTimeoutMs(opts.getTimeoutMs());
        if (opts.isVerbose()) cfg.setVerbose(true);
        if (cfg.getTarget() == null) {
            throw new IllegalArgumentException("must provide website url for crawling");
        }
        cfg.validate();
        return cfg;
    }

    static ReportRenderer rendererFor(CliOptions.Format format) {
        return format == CliOptions.Format.SITEMAP ? new SitemapXmlRenderer() : new JsonLinesRenderer();
    }

    private void crawl(CrawlConfig cfg, URI root, ReportRenderer renderer) throws IOException {
        CancellationSignal cancel = new CancellationSignal();
        BoundedWorkerPool pool = new BoundedWorkerPool(cfg.getWorkers(), cancel);

        // Ctrl+C → 새 디스패치 중단, 진행 중 노드만 마무리
        Thread hook = new Thread(cancel::cancel, "crawl-cancel");
        Runtime.getRuntime().addShutdownHook(hook);

        ReportStream reports = new ReportStream();
        try {
            new SiteCrawler(cfg).crawl(root, cfg.getMaxDepth(), pool, reports, cancel);
            Writer w = new OutputStreamWriter(out, StandardCharsets.UTF_8);
            renderer.render(reports, w);
            w.flush();
        } finally {
            pool.stop();
            try {
                Runtime.getRuntime().removeShutdownHook(hook);
            } catch (IllegalStateException ignore) {
                // 이미 종료 중이면 제거할 수 없음
            }
        }
    }
}
