package com.sitemapper.core.model;

import java.io.IOException;
import java.net.URI;
import java.util.Objects;

/** 노드 단위 실패. 종류(FailureKind)와 대상 URI를 함께 싣는다. */
public class CrawlException extends IOException {
    private static final long serialVersionUID = 1L;

    private final FailureKind kind;
    private final URI uri;
    private final int statusCode;

    public CrawlException(FailureKind kind, URI uri, String message) {
        this(kind, uri, -1, message, null);
    }

    public CrawlException(FailureKind kind, URI uri, int statusCode, String message) {
        this(kind, uri, statusCode, message, null);
    }

    public CrawlException(FailureKind kind, URI uri, int statusCode, String message, Throwable cause) {
        super(kind.reason() + " [" + uri + "]" + (message == null ? "" : ": " + message), cause);
        this.kind = Objects.requireNonNull(kind, "kind");
        this.uri = uri;
        this.statusCode = statusCode;
    }

    public FailureKind getKind() { return kind; }
    public URI getUri() { return uri; }
    /** 응답을 받았으면 그 코드, 아니면 -1 */
    public int getStatusCode() { return statusCode; }
}
