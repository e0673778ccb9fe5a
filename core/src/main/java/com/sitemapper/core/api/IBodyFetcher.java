// IBodyFetcher.java
package com.sitemapper.core.api;

import com.sitemapper.core.crawler.CancellationSignal;
import com.sitemapper.core.model.CrawlException;

import java.io.InputStream;
import java.net.URI;

/**
 * 본문 GET. 응답이 지금 시점에 live+html 이 아니면 CrawlException.
 * 반환 스트림은 호출자가 모든 경로에서 닫는다.
 */
@FunctionalInterface
public interface IBodyFetcher {
    InputStream fetch(URI url, CancellationSignal cancel) throws CrawlException;
}
