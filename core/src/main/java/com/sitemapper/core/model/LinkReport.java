package com.sitemapper.core.model;

import java.net.URI;
import java.util.List;
import java.util.Objects;

/**
 * 노드 하나의 결과: 경로 + 상태 + 그 페이지에서 찾은 같은 호스트 링크(1단계).
 * children 은 재귀 트리가 아니다. 전체 구조는 리포트 스트림에서 재구성한다.
 */
public final class LinkReport {
    private final URI path;
    private final Status status;
    private final List<LinkReport> children;

    public LinkReport(URI path, Status status, List<LinkReport> children) {
        this.path = Objects.requireNonNull(path, "path");
        this.status = Objects.requireNonNull(status, "status");
        this.children = (children == null) ? List.of() : List.copyOf(children);
    }

    /** 자식 없는 리포트 (dead / non-html / 자식 엔트리용) */
    public static LinkReport leaf(URI path, Status status) {
        return new LinkReport(path, status, List.of());
    }

    public URI getPath() { return path; }
    public Status getStatus() { return status; }
    public List<LinkReport> getChildren() { return children; }

    @Override public String toString() {
        return "LinkReport{" + path + ", " + status + ", children=" + children.size() + '}';
    }
}
