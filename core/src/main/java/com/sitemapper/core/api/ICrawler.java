// ICrawler.java
package com.sitemapper.core.api;

import com.sitemapper.core.crawler.CancellationSignal;
import com.sitemapper.core.crawler.ReportSink;
import com.sitemapper.core.crawler.WorkerPool;
import com.sitemapper.core.model.CrawlStats;

import java.net.URI;

/**
 * 크롤 런 진입점 최소 계약.
 * 리포트는 sink 로 밀어 넣고, 런이 끝나면 sink.complete() 가 정확히 한 번 호출된다.
 */
public interface ICrawler {

    /** 풀 기반 병렬 실행. 즉시 반환하며 완료는 sink 로 통지된다. 반환된 통계는 진행 중에도 갱신된다. */
    CrawlStats crawl(URI root, int maxDepth, WorkerPool pool, ReportSink sink, CancellationSignal cancel);

    /** 풀 없이 호출 스레드에서 전부 실행. sink 가 닫힌 뒤 반환한다. */
    CrawlStats crawlSerial(URI root, int maxDepth, ReportSink sink, CancellationSignal cancel);
}
