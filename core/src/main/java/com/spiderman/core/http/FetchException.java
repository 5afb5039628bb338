package com.spiderman.core.http;

/**
 * fetch 실패 (연결/DNS/타임아웃/비정상 응답).
 * 오케스트레이터는 실패 카운트만 올리고 다음 URL로 넘어간다 (재시도 없음).
 */
public class FetchException extends Exception {

    public enum Kind { CONNECT, DNS, TIMEOUT, HTTP_STATUS, MALFORMED, INTERRUPTED }

    private final String url;
    private final Kind kind;
    private final int statusCode;

    public FetchException(String url, Kind kind, String message) {
        this(url, kind, -1, message, null);
    }

    public FetchException(String url, Kind kind, String message, Throwable cause) {
        this(url, kind, -1, message, cause);
    }

    public FetchException(String url, Kind kind, int statusCode, String message, Throwable cause) {
        super(message, cause);
        this.url = url;
        this.kind = kind;
        this.statusCode = statusCode;
    }

    public String getUrl() { return url; }
    public Kind getKind() { return kind; }
    /** HTTP_STATUS일 때만 의미 있음, 그 외 -1 */
    public int getStatusCode() { return statusCode; }
}
