// IStatusProber.java
package com.sitemapper.core.api;

import com.sitemapper.core.crawler.CancellationSignal;
import com.sitemapper.core.model.Status;

import java.net.URI;

/** 존재 확인(HEAD 수준) 후 Status로 분류. 실패는 예외 대신 not-live Status로 돌려준다. */
@FunctionalInterface
public interface IStatusProber {
    Status probe(URI url, CancellationSignal cancel);

    default Status probe(URI url) { return probe(url, new CancellationSignal()); }
}
