package com.sitemapper.core.http;

import com.sitemapper.core.api.IBodyFetcher;
import com.sitemapper.core.crawler.CancellationSignal;
import com.sitemapper.core.model.CrawlConfig;
import com.sitemapper.core.model.CrawlException;
import com.sitemapper.core.model.FailureKind;
import com.sitemapper.core.model.Status;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * 본문 GET. probe 와 fetch 사이에 상태가 바뀔 수 있으므로 같은 분류를 다시 적용한다.
 */
public class HttpBodyFetcher implements IBodyFetcher {

    private static final Logger LOG = LoggerFactory.getLogger(HttpBodyFetcher.class);

    private final HttpClient client;
    private final Duration timeout;
    private final String userAgent;

    public HttpBodyFetcher(CrawlConfig config) {
        this(HttpSupport.newClient(config), config.getTimeout(), config.getUserAgent());
    }

    public HttpBodyFetcher(HttpClient client, Duration timeout, String userAgent) {
        this.client = Objects.requireNonNull(client, "client");
        this.timeout = Objects.requireNonNull(timeout, "timeout");
        this.userAgent = (userAgent == null || userAgent.isBlank()) ? CrawlConfig.DEFAULT_USER_AGENT : userAgent;
    }

    @Override
    public InputStream fetch(URI url, CancellationSignal cancel) throws CrawlException {
        Objects.requireNonNull(url, "url");
        HttpRequest req;
        try {
            req = HttpRequest.newBuilder(url)
                    .timeout(timeout)
                    .header("User-Agent", userAgent)
                    .header("Accept", "text/html,application/xhtml+xml;q=0.9,*/*;q=0.8")
                    .GET()
                    .build();
        } catch (IllegalArgumentException e) {
            throw new CrawlException(FailureKind.TRANSPORT, url, -1, HttpSupport.describe(e), e);
        }

        HttpResponse<InputStream> res;
        try {
            res = HttpSupport.send(client, req, HttpResponse.BodyHandlers.ofInputStream(), cancel);
        } catch (CrawlException e) {
            throw e;
        } catch (IOException e) {
            throw new CrawlException(FailureKind.TRANSPORT, url, -1, HttpSupport.describe(e), e);
        }

        String contentType = res.headers().firstValue("Content-Type").orElse(null);
        Status now = HttpSupport.classify(res.statusCode(), contentType, Instant.now());
        if (now.isLive() && now.isCrawlable()) {
            return res.body();
        }

        closeQuietly(res.body(), url);
        throw new CrawlException(now.getFailure(), url, res.statusCode(), contentType);
    }

    private static void closeQuietly(InputStream in, URI url) {
        if (in == null) return;
        try {
            in.close();
        } catch (IOException e) {
            LOG.debug("closing body of {} failed: {}", url, e.getMessage());
        }
    }
}
