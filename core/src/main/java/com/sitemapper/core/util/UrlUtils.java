package com.sitemapper.core.util;

import org.jsoup.internal.StringUtil;

import java.net.URI;
import java.net.URISyntaxException;

/** 경로 정규화 + same-host 판정 + 상대 URL 해석 유틸 */
public final class UrlUtils {
    private UrlUtils(){}

    /** 루트 표기 */
    public static final String ROOT_PATH = "/";

    /**
     * 중복 판정용 키: 경로의 끝 슬래시 하나 제거, 비면 "/".
     * 쿼리/프래그먼트는 키에 포함하지 않는다.
     */
    public static String normalizePath(URI u) {
        if (u == null) return ROOT_PATH;
        String path = u.getPath();
        if (path == null) path = "";
        if (path.endsWith("/")) path = path.substring(0, path.length() - 1);
        return path.isEmpty() ? ROOT_PATH : path;
    }

    /** host 문자열(+포트) 완전 일치. 대소문자 변환 없음. */
    public static boolean sameHost(URI a, URI b) {
        if (a == null || b == null) return false;
        String ha = a.getHost();
        if (ha == null || !ha.equals(b.getHost())) return false;
        return a.getPort() == b.getPort();
    }

    /**
     * raw 값을 base 기준으로 해석 (jsoup 의 브라우저식 결합: "?q", "#frag", "" 는 base 경로 유지).
     * 절대 URL은 그대로. 결과가 절대 URI로 파싱되지 않으면 null.
     */
    public static URI resolve(URI base, String raw) {
        if (raw == null) return null;
        try {
            String abs = StringUtil.resolve(base == null ? "" : base.toString(), raw);
            if (abs.isEmpty()) return null;
            URI u = new URI(abs);
            return u.isAbsolute() ? u : null;
        } catch (URISyntaxException | IllegalArgumentException e) {
            return null;
        }
    }
}
