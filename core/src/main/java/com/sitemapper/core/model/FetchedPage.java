package com.sitemapper.core.model;

import java.net.URI;
import java.util.Locale;

/** fetch 결과 (파서 입력) */
public final class FetchedPage {
    private final URI requestUri;
    private final URI finalUri;      // 리다이렉트 후 최종 URI (없으면 요청 URI)
    private final int statusCode;
    private final String contentType; // null 허용
    private final String body;

    public FetchedPage(URI requestUri, URI finalUri, int statusCode, String contentType, String body) {
        this.requestUri = requestUri;
        this.finalUri = (finalUri != null ? finalUri : requestUri);
        this.statusCode = statusCode;
        this.contentType = contentType;
        this.body = (body == null ? "" : body);
    }

    /** 테스트/페이크용 200 text/html 응답 */
    public static FetchedPage html(URI uri, String body) {
        return new FetchedPage(uri, uri, 200, "text/html; charset=UTF-8", body);
    }

    public URI getRequestUri() { return requestUri; }
    public URI getFinalUri() { return finalUri; }
    public int getStatusCode() { return statusCode; }
    public String getContentType() { return contentType; }
    public String getBody() { return body; }

    /** Content-Type 이 없으면 HTML로 간주 */
    public boolean isHtml() {
        if (contentType == null || contentType.isBlank()) return true;
        String ct = contentType.toLowerCase(Locale.ROOT);
        return ct.contains("text/html") || ct.contains("application/xhtml+xml");
    }
}
