package com.sitemapper.core.http;

import com.sitemapper.core.crawler.CancellationSignal;
import com.sitemapper.core.model.CrawlConfig;
import com.sitemapper.core.model.CrawlException;
import com.sitemapper.core.model.FailureKind;
import com.sitemapper.core.model.Status;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Instant;
import java.util.Locale;
import java.util.Objects;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;

/** Prober/Fetcher 공용: 클라이언트 생성, 취소 가능한 송신, 응답 분류 */
public final class HttpSupport {
    private HttpSupport() {}

    /** 마지막 상태 코드가 없는(전송 실패) 경우에 기록하는 값 */
    static final int TRANSPORT_FAILURE_CODE = 500;

    /** 설정 기반 기본 HttpClient (connect timeout = 요청 타임아웃) */
    public static HttpClient newClient(CrawlConfig config) {
        Objects.requireNonNull(config, "config");
        return HttpClient.newBuilder()
                .followRedirects(config.isFollowRedirects() ? HttpClient.Redirect.NORMAL : HttpClient.Redirect.NEVER)
                .connectTimeout(config.getTimeout())
                .build();
    }

    static boolean isSuccess(int code) {
        return code >= 200 && code <= 299;
    }

    static boolean isHtml(String contentType) {
        if (contentType == null) return false;
        String ct = contentType.toLowerCase(Locale.ROOT);
        return ct.contains("text/html") || ct.contains("text/xhtml");
    }

    /** 응답 코드 + Content-Type → Status (표 그대로) */
    static Status classify(int code, String contentType, Instant at) {
        if (!isSuccess(code)) {
            return Status.builder()
                    .observedAt(at)
                    .lastStatusCode(code)
                    .failure(FailureKind.PAGE_FAILED)
                    .build();
        }
        if (!isHtml(contentType)) {
            return Status.builder()
                    .observedAt(at)
                    .live(true)
                    .lastStatusCode(code)
                    .failure(FailureKind.NON_HTML)
                    .failureDetail(contentType)
                    .build();
        }
        return Status.builder()
                .observedAt(at)
                .live(true)
                .crawlable(true)
                .lastStatusCode(code)
                .build();
    }

    static Status transportFailure(Instant at, String detail) {
        return Status.builder()
                .observedAt(at)
                .lastStatusCode(TRANSPORT_FAILURE_CODE)
                .failure(FailureKind.TRANSPORT)
                .failureDetail(detail)
                .build();
    }

    /**
     * sendAsync + 취소 신호 연동. 신호가 울리면 대기 중인 future 를 취소해
     * 워커가 클라이언트 타임아웃까지 묶여 있지 않게 한다.
     */
    static <T> HttpResponse<T> send(HttpClient client, HttpRequest req,
                                    HttpResponse.BodyHandler<T> handler,
                                    CancellationSignal cancel) throws IOException {
        URI uri = req.uri();
        if (cancel.isCancelled()) {
            throw new CrawlException(FailureKind.TRANSPORT, uri, "cancelled");
        }
        CompletableFuture<HttpResponse<T>> cf = client.sendAsync(req, handler);
        try (CancellationSignal.Registration ignored = cancel.onCancel(() -> cf.cancel(true))) {
            return cf.get();
        } catch (CancellationException e) {
            throw new CrawlException(FailureKind.TRANSPORT, uri, -1, "cancelled", e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            cf.cancel(true);
            throw new CrawlException(FailureKind.TRANSPORT, uri, -1, "interrupted", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            throw new CrawlException(FailureKind.TRANSPORT, uri, -1, describe(cause), cause);
        }
    }

    static String describe(Throwable t) {
        String msg = t.getMessage();
        return t.getClass().getSimpleName() + (msg == null || msg.isBlank() ? "" : ": " + msg);
    }
}
