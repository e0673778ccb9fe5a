package com.sitemapper.core.model;

import java.time.Duration;
import java.util.Objects;

/**
 * 크롤 설정 (crawl.yml 매핑 대상) — 순수 설정 보관용.
 * CLI 플래그 오버라이드는 app-cli 쪽에서 처리한다.
 */
public final class CrawlConfig {

    public static final String DEFAULT_USER_AGENT = "SiteMapper/0.1";

    // ---------- 기본 필드 ----------
    private String target;                              // 루트 URL (필수)
    private int maxDepth = 0;                           // 0 이하 = 무제한
    private int workers = 8;                            // 워커 풀 상한(동시 요청 상한)
    private Duration timeout = Duration.ofSeconds(5);   // 요청 타임아웃
    private boolean followRedirects = true;
    private String userAgent = DEFAULT_USER_AGENT;
    private boolean verbose = false;                    // 노드별 Scanning/Done 로그

    // ---------- getters ----------
    public String getTarget() { return target; }
    public int getMaxDepth() { return maxDepth; }
    public int getWorkers() { return workers; }
    public Duration getTimeout() { return timeout; }
    public boolean isFollowRedirects() { return followRedirects; }
    public String getUserAgent() { return userAgent; }
    public boolean isVerbose() { return verbose; }

    /** maxDepth 가 양수일 때만 깊이 제한이 걸린다. */
    public boolean isDepthBounded() { return maxDepth > 0; }

    // ---------- fluent setters ----------
    public CrawlConfig setTarget(String target) { this.target = target; return this; }
    public CrawlConfig setMaxDepth(int maxDepth) { this.maxDepth = maxDepth; return this; }
    public CrawlConfig setWorkers(int workers) { this.workers = workers; return this; }
    public CrawlConfig setTimeout(Duration timeout) { this.timeout = timeout; return this; }
    public CrawlConfig setFollowRedirects(boolean v) { this.followRedirects = v; return this; }
    public CrawlConfig setVerbose(boolean v) { this.verbose = v; return this; }
    public CrawlConfig setUserAgent(String ua) {
        this.userAgent = (ua == null || ua.isBlank()) ? DEFAULT_USER_AGENT : ua;
        return this;
    }

    // ---------- validate ----------
    public void validate() {
        Objects.requireNonNull(target, "target");
        if (target.isBlank()) throw new IllegalArgumentException("target must not be blank");
        if (workers < 1) throw new IllegalArgumentException("workers must be >= 1");
        if (timeout == null || timeout.isNegative() || timeout.isZero())
            throw new IllegalArgumentException("timeout must be > 0");
    }

    // ---------- helpers ----------
    public static CrawlConfig defaults() { return new CrawlConfig(); }

    public long getTimeoutMs() { return timeout.toMillis(); }

    public CrawlConfig setTimeoutMs(long ms) {
        this.timeout = Duration.ofMillis(Math.max(1, ms));
        return this;
    }
}
