package com.sitemapper.core.http;

import java.net.URI;

/** 한 URL의 fetch 실패(네트워크 오류 또는 비-2xx). 크롤 전체는 계속된다. */
public class FetchException extends Exception {
    private final URI url;
    private final int statusCode; // 응답 자체가 없으면 -1

    public FetchException(URI url, int statusCode, String message) {
        super(message);
        this.url = url;
        this.statusCode = statusCode;
    }

    public FetchException(URI url, String message, Throwable cause) {
        super(message, cause);
        this.url = url;
        this.statusCode = -1;
    }

    public static FetchException badStatus(URI url, int statusCode) {
        return new FetchException(url, statusCode, "HTTP " + statusCode + " for " + url);
    }

    public URI getUrl() { return url; }

    public int getStatusCode() { return statusCode; }
}
