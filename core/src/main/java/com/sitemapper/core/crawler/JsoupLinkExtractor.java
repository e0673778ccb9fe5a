package com.sitemapper.core.crawler;

import com.sitemapper.core.util.UrlUtils;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Attribute;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;

import java.io.IOException;
import java.io.InputStream;
import java.net.URI;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * JSoup 기반 링크 추출기: 모든 요소의 href / src / srcset 수집.
 * - "javascript:void(0)" 를 포함한 값은 제외
 * - srcset 은 콤마로 나눠 후보별 URL 토큰(1x, 480w 같은 디스크립터 제외)만 사용
 * - 빈 href/src 는 브라우저처럼 페이지 자신으로 해석 ("?q", "#frag" 도 페이지 경로 유지)
 */
public class JsoupLinkExtractor implements LinkExtractor {

    static final String VOID_PLACEHOLDER = "javascript:void(0)";

    @Override
    public Set<URI> extract(InputStream body, URI base) throws IOException {
        Objects.requireNonNull(body, "body");
        // 문자셋은 meta/BOM 에서 감지
        Document doc = Jsoup.parse(body, null, base == null ? "" : base.toString());

        Map<String, URI> out = new LinkedHashMap<>();
        for (Element el : doc.getAllElements()) {
            if (el.attributesSize() == 0) continue;
            for (Attribute attr : el.attributes()) {
                switch (attr.getKey().toLowerCase(Locale.ROOT)) {
                    case "href", "src" -> collect(out, base, attr.getValue());
                    case "srcset" -> {
                        for (String candidate : attr.getValue().split(",")) {
                            String token = urlToken(candidate);
                            if (!token.isEmpty()) collect(out, base, token);
                        }
                    }
                    default -> { }
                }
            }
        }
        return new LinkedHashSet<>(out.values());
    }

    private static void collect(Map<String, URI> out, URI base, String raw) {
        if (raw == null || raw.contains(VOID_PLACEHOLDER)) return;
        URI u = UrlUtils.resolve(base, raw);
        if (u == null) return; // 잘못된 URL은 무시
        out.putIfAbsent(u.toString(), u);
    }

    /** "img@2x.png 2x" → "img@2x.png" */
    private static String urlToken(String candidate) {
        String c = candidate.trim();
        if (c.contains(VOID_PLACEHOLDER)) return c;
        int sp = indexOfWhitespace(c);
        return sp < 0 ? c : c.substring(0, sp);
    }

    private static int indexOfWhitespace(String s) {
        for (int i = 0; i < s.length(); i++) {
            if (Character.isWhitespace(s.charAt(i))) return i;
        }
        return -1;
    }
}
