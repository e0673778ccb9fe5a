package com.sitemapper.core.model;

import java.time.Instant;
import java.util.Objects;

/**
 * 한 URL의 도달성/크롤 가능 여부 스냅샷 (불변).
 * 리포트 하나당 정확히 하나가 붙는다.
 */
public final class Status {
    private final boolean live;
    private final boolean crawlable;
    private final int lastStatusCode;
    private final Instant observedAt;
    private final FailureKind failure;     // 정상이면 null
    private final String failureDetail;    // 예외 메시지 등(옵션)

    private Status(Builder b) {
        this.live = b.live;
        this.crawlable = b.crawlable;
        this.lastStatusCode = b.lastStatusCode;
        this.observedAt = b.observedAt;
        this.failure = b.failure;
        this.failureDetail = b.failureDetail;
    }

    public boolean isLive() { return live; }
    public boolean isCrawlable() { return crawlable; }
    public int getLastStatusCode() { return lastStatusCode; }
    public Instant getObservedAt() { return observedAt; }
    public FailureKind getFailure() { return failure; }
    public String getFailureDetail() { return failureDetail; }

    /** 사람이 읽는 실패 사유. 정상이면 null. */
    public String reason() {
        if (failure == null) return null;
        if (failureDetail == null || failureDetail.isBlank()) return failure.reason();
        return failure.reason() + ": " + failureDetail;
    }

    /**
     * live=false 로 내린 사본. crawlable 은 그대로 둔다
     * (not-live 노드는 어차피 하위 탐색 대상이 아님).
     */
    public Status downgradeToNotLive(FailureKind kind, String detail) {
        return toBuilder()
                .live(false)
                .failure(kind)
                .failureDetail(detail)
                .build();
    }

    public Builder toBuilder() {
        return builder()
                .live(live)
                .crawlable(crawlable)
                .lastStatusCode(lastStatusCode)
                .observedAt(observedAt)
                .failure(failure)
                .failureDetail(failureDetail);
    }

    @Override public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Status s)) return false;
        return live == s.live && crawlable == s.crawlable && lastStatusCode == s.lastStatusCode
                && Objects.equals(observedAt, s.observedAt) && failure == s.failure
                && Objects.equals(failureDetail, s.failureDetail);
    }

    @Override public int hashCode() {
        return Objects.hash(live, crawlable, lastStatusCode, observedAt, failure, failureDetail);
    }

    @Override public String toString() {
        return "Status{live=" + live + ", crawlable=" + crawlable + ", code=" + lastStatusCode
                + (failure != null ? ", reason=" + reason() : "") + '}';
    }

    // ----- 빌더 -----
    public static Builder builder() { return new Builder(); }

    public static final class Builder {
        private boolean live;
        private boolean crawlable;
        private int lastStatusCode;
        private Instant observedAt;
        private FailureKind failure;
        private String failureDetail;

        public Builder live(boolean live) { this.live = live; return this; }
        public Builder crawlable(boolean crawlable) { this.crawlable = crawlable; return this; }
        public Builder lastStatusCode(int code) { this.lastStatusCode = code; return this; }
        public Builder observedAt(Instant at) { this.observedAt = at; return this; }
        public Builder failure(FailureKind failure) { this.failure = failure; return this; }
        public Builder failureDetail(String detail) { this.failureDetail = detail; return this; }

        public Status build() {
            if (observedAt == null) observedAt = Instant.now();
            return new Status(this);
        }
    }
}
