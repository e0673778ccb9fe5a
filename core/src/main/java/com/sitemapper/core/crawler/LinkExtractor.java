package com.sitemapper.core.crawler;

import java.io.IOException;
import java.io.InputStream;
import java.net.URI;
import java.util.Set;

/** HTML 본문에서 절대 URL 후보를 뽑는 전략 인터페이스. 호스트 필터링은 하지 않는다. */
@FunctionalInterface
public interface LinkExtractor {
    /**
     * body 를 읽어 base 기준으로 해석된 URL 집합(해석 문자열 기준 중복 제거)을 반환.
     * 잘못된 URL 값은 조용히 버린다. 본문 읽기 실패만 예외로 올린다.
     */
    Set<URI> extract(InputStream body, URI base) throws IOException;
}
