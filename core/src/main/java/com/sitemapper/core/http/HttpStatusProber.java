package com.sitemapper.core.http;

import com.sitemapper.core.api.IStatusProber;
import com.sitemapper.core.crawler.CancellationSignal;
import com.sitemapper.core.model.CrawlConfig;
import com.sitemapper.core.model.CrawlException;
import com.sitemapper.core.model.Status;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/** HEAD 요청으로 존재/콘텐츠 타입만 확인하는 Prober. 전송 실패도 Status로 흡수한다. */
public class HttpStatusProber implements IStatusProber {

    private static final Logger LOG = LoggerFactory.getLogger(HttpStatusProber.class);

    private final HttpClient client;
    private final Duration timeout;
    private final String userAgent;

    public HttpStatusProber(CrawlConfig config) {
        this(HttpSupport.newClient(config), config.getTimeout(), config.getUserAgent());
    }

    public HttpStatusProber(HttpClient client, Duration timeout, String userAgent) {
        this.client = Objects.requireNonNull(client, "client");
        this.timeout = Objects.requireNonNull(timeout, "timeout");
        this.userAgent = (userAgent == null || userAgent.isBlank()) ? CrawlConfig.DEFAULT_USER_AGENT : userAgent;
    }

    @Override
    public Status probe(URI url, CancellationSignal cancel) {
        Objects.requireNonNull(url, "url");
        Instant now = Instant.now();
        try {
            HttpRequest req = HttpRequest.newBuilder(url)
                    .timeout(timeout)
                    .header("User-Agent", userAgent)
                    .method("HEAD", HttpRequest.BodyPublishers.noBody())
                    .build();

            HttpResponse<Void> res = HttpSupport.send(client, req, HttpResponse.BodyHandlers.discarding(), cancel);
            String contentType = res.headers().firstValue("Content-Type").orElse(null);
            return HttpSupport.classify(res.statusCode(), contentType, now);
        } catch (CrawlException e) {
            LOG.debug("HEAD {} failed: {}", url, e.getMessage());
            return HttpSupport.transportFailure(now, e.getMessage());
        } catch (IOException e) {
            LOG.debug("HEAD {} failed: {}", url, e.getMessage());
            return HttpSupport.transportFailure(now, HttpSupport.describe(e));
        } catch (IllegalArgumentException e) {
            // http/https 가 아닌 스킴 등 요청 자체를 만들 수 없는 URL
            LOG.debug("HEAD {} rejected: {}", url, e.getMessage());
            return HttpSupport.transportFailure(now, HttpSupport.describe(e));
        }
    }
}
