package com.spiderman.core.http;

import com.spiderman.core.api.IPageFetcher;
import com.spiderman.core.model.CrawlConfig;
import com.spiderman.core.model.FetchedPage;

import java.io.IOException;
import java.net.URI;
import java.net.UnknownHostException;
import java.net.http.HttpClient;
import java.net.http.HttpHeaders;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.nio.channels.UnresolvedAddressException;
import java.time.Duration;
import java.util.Objects;

/**
 * java.net.http 기반 fetcher: GET 1회, 리다이렉트 미추종, 요청마다 타임아웃.
 * 2xx만 성공, 그 외 상태코드/예외는 FetchException으로 변환.
 */
public class HttpPageFetcher implements IPageFetcher {

    /** 테스트/모킹용 송신 훅 */
    @FunctionalInterface
    public interface HttpSender {
        HttpResponse<String> send(HttpRequest req) throws IOException, InterruptedException;
    }

    private static final String ACCEPT = "text/html,application/xhtml+xml,application/xml;q=0.9,*/*;q=0.8";

    private final Duration timeout;
    private final String userAgent;
    private final HttpSender sender;

    public HttpPageFetcher(CrawlConfig config) {
        this(config, defaultSender(config.getTimeout()));
    }

    /** 테스트용 생성자(송신 훅 주입) */
    public HttpPageFetcher(CrawlConfig config, HttpSender sender) {
        Objects.requireNonNull(config, "config");
        this.timeout = config.getTimeout();
        this.userAgent = config.getUserAgent();
        this.sender = Objects.requireNonNull(sender, "sender");
    }

    private static HttpSender defaultSender(Duration connectTimeout) {
        HttpClient client = HttpClient.newBuilder()
                .followRedirects(HttpClient.Redirect.NEVER)
                .connectTimeout(connectTimeout)
                .build();
        // Content-Type의 charset으로 디코딩, 없으면 UTF-8
        return req -> client.send(req, HttpResponse.BodyHandlers.ofString());
    }

    @Override
    public FetchedPage fetch(String url) throws FetchException {
        Objects.requireNonNull(url, "url");

        URI uri;
        try {
            uri = URI.create(url);
        } catch (IllegalArgumentException e) {
            throw new FetchException(url, FetchException.Kind.MALFORMED, "invalid URL: " + e.getMessage(), e);
        }
        if (uri.getHost() == null) {
            throw new FetchException(url, FetchException.Kind.MALFORMED, "URL has no host");
        }

        long start = System.nanoTime();
        HttpResponse<String> resp;
        try {
            HttpRequest req = HttpRequest.newBuilder(uri)
                    .timeout(timeout)
                    .header("User-Agent", userAgent)
                    .header("Accept", ACCEPT)
                    .GET()
                    .build();
            resp = sender.send(req);
        } catch (HttpTimeoutException e) {
            throw new FetchException(url, FetchException.Kind.TIMEOUT, "timed out after " + timeout.toMillis() + "ms", e);
        } catch (IOException e) {
            if (isUnresolvedHost(e)) {
                throw new FetchException(url, FetchException.Kind.DNS, "unknown host: " + uri.getHost(), e);
            }
            throw new FetchException(url, FetchException.Kind.CONNECT, "connection failed: " + e.getMessage(), e);
        } catch (IllegalArgumentException e) {
            // 지원하지 않는 scheme 등 요청 생성 실패
            throw new FetchException(url, FetchException.Kind.MALFORMED, e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new FetchException(url, FetchException.Kind.INTERRUPTED, "interrupted", e);
        }

        long elapsedMs = (System.nanoTime() - start) / 1_000_000;
        if (resp == null) {
            throw new FetchException(url, FetchException.Kind.MALFORMED, "no response");
        }

        int status = resp.statusCode();
        if (status < 200 || status > 299) {
            throw new FetchException(url, FetchException.Kind.HTTP_STATUS, status, "HTTP " + status, null);
        }

        HttpHeaders hh = resp.headers();
        return FetchedPage.builder()
                .url(url)
                .statusCode(status)
                .headers(hh == null ? null : hh.map())
                .body(resp.body() == null ? "" : resp.body())
                .contentType(hh == null ? null : hh.firstValue("Content-Type").orElse(null))
                .responseTimeMs(elapsedMs)
                .build();
    }

    /** HttpClient는 이름 해석 실패를 ConnectException(cause=UnresolvedAddressException)으로 던진다 */
    static boolean isUnresolvedHost(Throwable e) {
        for (Throwable c = e; c != null; c = c.getCause()) {
            if (c instanceof UnknownHostException || c instanceof UnresolvedAddressException) return true;
            if (c.getCause() == c) break;
        }
        return false;
    }
}
