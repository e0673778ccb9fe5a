package com.sitemapper.core.crawler;

import com.sitemapper.core.model.CrawlException;
import com.sitemapper.core.model.FailureKind;
import com.sitemapper.core.model.LinkReport;
import com.sitemapper.core.model.Status;
import com.sitemapper.core.util.UrlUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.net.URI;
import java.util.List;
import java.util.Objects;

/**
 * 노드 하나의 probe → fetch → extract → report → 자식 제출 사이클.
 * 제출마다 새로 만드는 불변 값이며, 제출 후 변경되지 않는다.
 */
final class CrawlTask implements Runnable {

    private static final Logger LOG = LoggerFactory.getLogger(CrawlTask.class);

    private final CrawlRun run;
    private final URI target;
    private final int depth;
    private final Status precomputed;   // 부모가 자식 추출 중 이미 probe 한 경우

    CrawlTask(CrawlRun run, URI target, int depth, Status precomputed) {
        this.run = Objects.requireNonNull(run, "run");
        this.target = Objects.requireNonNull(target, "target");
        this.depth = depth;
        this.precomputed = precomputed;
    }

    URI target() { return target; }
    int depth() { return depth; }

    @Override
    public void run() {
        run.stats.nodeStarted();
        try {
            visit();
        } catch (RuntimeException e) {
            // 선점 전 실패 등. 노드 단위 실패는 런을 중단시키지 않는다
            LOG.warn("Node {} aborted", target, e);
        } finally {
            run.stats.nodeFinished();
            run.outstanding.done();
        }
    }

    private void visit() {
        String key = UrlUtils.normalizePath(target);

        // 이미 선점된 경로면 첫 선점자가 리포트한다
        if (run.seen.has(key)) return;

        if (run.depthBounded() && depth >= run.maxDepth) return;

        // 블로킹 I/O 전에 선점. 동시 선점 경쟁에서 지면 종료
        if (!run.seen.claim(key)) return;

        if (run.cancel.isCancelled()) return;

        logScanning();
        NodeState node = new NodeState();
        try {
            crawlNode(node);
        } catch (RuntimeException e) {
            // 선점한 경로는 다른 워커가 다시 보지 않으므로 여기서 종단 리포트를 낸다
            LOG.warn("Node {} failed", target, e);
            if (!node.emitted && !run.cancel.isCancelled()) {
                emit(node, LinkReport.leaf(target, failedStatus(node.status, e)));
            }
        } finally {
            logDone();
        }
    }

    /** 한 노드 처리 동안만 쓰는 상태 (단일 워커 스레드) */
    private static final class NodeState {
        Status status;
        boolean emitted;
    }

    private void emit(NodeState node, LinkReport report) {
        node.emitted = true;
        run.emit(report);
    }

    static Status failedStatus(Status known, RuntimeException e) {
        String detail = e.getClass().getSimpleName() + (e.getMessage() == null ? "" : ": " + e.getMessage());
        if (known != null) return known.downgradeToNotLive(FailureKind.NODE_FAILED, detail);
        return Status.builder()
                .lastStatusCode(500)
                .failure(FailureKind.NODE_FAILED)
                .failureDetail(detail)
                .build();
    }

    private void crawlNode(NodeState node) {
        Status status = (precomputed != null) ? precomputed : run.prober.probe(target, run.cancel);
        node.status = status;
        if (run.cancel.isCancelled()) return;

        // dead 또는 live 이지만 html 아님 → 자식 없이 리포트
        if (!status.isLive() || !status.isCrawlable()) {
            emit(node, LinkReport.leaf(target, status));
            return;
        }

        InputStream body;
        try {
            body = run.fetcher.fetch(target, run.cancel);
        } catch (CrawlException e) {
            if (run.cancel.isCancelled()) return;
            LOG.debug("Fetch failed {}: {}", target, e.getMessage());
            emit(node, LinkReport.leaf(target, status.downgradeToNotLive(FailureKind.FETCH_FAILED, e.getMessage())));
            return;
        }

        List<LinkReport> children;
        try (InputStream in = body) {
            children = run.bodyCrawler.crawlBody(target, in, run.cancel);
        } catch (IOException e) {
            if (run.cancel.isCancelled()) return;
            LOG.debug("Reading body of {} failed: {}", target, e.getMessage());
            emit(node, LinkReport.leaf(target, status));
            return;
        }
        if (run.cancel.isCancelled()) return;

        emit(node, new LinkReport(target, status, children));

        // dead / non-html 자식도 제출한다: 자기 노드에서 probe 없이 종단 리포트만 낸다
        int next = depth + 1;
        for (LinkReport kid : children) {
            if (run.seen.has(UrlUtils.normalizePath(kid.getPath()))) continue;
            if (run.cancel.isCancelled()) return;
            run.dispatch(new CrawlTask(run, kid.getPath(), next, kid.getStatus()));
        }
    }

    private void logScanning() {
        if (run.verbose) LOG.info("Scanning \"{}\" from \"{}\" (depth {})", target.getPath(), target.getHost(), depth);
        else LOG.debug("Scanning {} (depth {})", target, depth);
    }

    private void logDone() {
        if (run.verbose) LOG.info("Done scanning \"{}\" from \"{}\"", target.getPath(), target.getHost());
    }
}
