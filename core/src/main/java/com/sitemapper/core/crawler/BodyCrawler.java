package com.sitemapper.core.crawler;

import com.sitemapper.core.api.IStatusProber;
import com.sitemapper.core.model.LinkReport;
import com.sitemapper.core.util.UrlUtils;

import java.io.IOException;
import java.io.InputStream;
import java.net.URI;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * 페이지 본문 → 같은 호스트 자식 링크 + 각 자식의 Status.
 * 호스트는 대상 페이지의 host(+포트)와 완전 일치해야 한다. web.example.com 은 example.com 이 아니다.
 */
public final class BodyCrawler {

    private final LinkExtractor extractor;
    private final IStatusProber prober;

    public BodyCrawler(LinkExtractor extractor, IStatusProber prober) {
        this.extractor = Objects.requireNonNull(extractor, "extractor");
        this.prober = Objects.requireNonNull(prober, "prober");
    }

    public List<LinkReport> crawlBody(URI target, InputStream body) throws IOException {
        return crawlBody(target, body, new CancellationSignal());
    }

    /** 취소되면 남은 자식 probe 를 건너뛰고 지금까지의 목록을 돌려준다. */
    public List<LinkReport> crawlBody(URI target, InputStream body, CancellationSignal cancel) throws IOException {
        Set<URI> links = extractor.extract(body, target);

        List<LinkReport> kids = new ArrayList<>();
        for (URI link : links) {
            if (!UrlUtils.sameHost(target, link)) continue;
            if (cancel.isCancelled()) break;
            kids.add(LinkReport.leaf(link, prober.probe(link, cancel)));
        }
        return kids;
    }
}
