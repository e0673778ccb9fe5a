package com.sitemapper.core.model;

/** 노드 실패 분류(닫힌 집합). Status.failure 및 CrawlException에 실린다. */
public enum FailureKind {
    /** DNS/연결/타임아웃 등 전송 계층 실패 */
    TRANSPORT("transport error"),
    /** 2xx 이외 응답 */
    PAGE_FAILED("page failed"),
    /** 2xx 이지만 html이 아님 */
    NON_HTML("non-html"),
    /** probe는 통과했으나 본문 GET 실패 */
    FETCH_FAILED("fetch failed"),
    /** 노드 처리 중 예기치 못한 실패 (선점 후라 종단 리포트로 대체) */
    NODE_FAILED("node failed");

    private final String reason;

    FailureKind(String reason) { this.reason = reason; }

    /** 리포트/렌더러에 노출되는 짧은 사유 문자열 */
    public String reason() { return reason; }
}
