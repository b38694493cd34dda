package com.sitemapper.core.http;

import com.sitemapper.core.api.IPageFetcher;
import com.sitemapper.core.model.CrawlConfig;
import com.sitemapper.core.model.FetchedPage;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.util.Objects;

/** java.net.http 기반 기본 fetcher: GET 1회, 재시도 없음 */
public class HttpPageFetcher implements IPageFetcher {

    /** 테스트/모킹용 송신 훅 */
    @FunctionalInterface
    public interface HttpSender {
        HttpResponse<String> send(HttpRequest req) throws IOException, InterruptedException;
    }

    private final CrawlConfig.HttpCfg cfg;
    private final HttpSender sender;

    public HttpPageFetcher(CrawlConfig config) {
        this(config, newClient(Objects.requireNonNull(config, "config").getHttp()));
    }

    /** 본문은 Content-Type charset 기준으로 디코딩(없으면 UTF-8) */
    public HttpPageFetcher(CrawlConfig config, HttpClient client) {
        this.cfg = Objects.requireNonNull(config, "config").getHttp();
        Objects.requireNonNull(client, "client");
        this.sender = req -> client.send(req, HttpResponse.BodyHandlers.ofString());
    }

    /** 테스트용 생성자(송신 훅 주입) */
    public HttpPageFetcher(CrawlConfig config, HttpSender testSender) {
        this.cfg = Objects.requireNonNull(config, "config").getHttp();
        this.sender = Objects.requireNonNull(testSender, "testSender");
    }

    private static HttpClient newClient(CrawlConfig.HttpCfg http) {
        return HttpClient.newBuilder()
                .followRedirects(http.isFollowRedirects() ? HttpClient.Redirect.NORMAL : HttpClient.Redirect.NEVER)
                .connectTimeout(http.getConnectTimeout())
                .build();
    }

    @Override
    public FetchedPage fetch(URI url) throws FetchException, InterruptedException {
        Objects.requireNonNull(url, "url");
        HttpRequest req;
        try {
            req = HttpRequest.newBuilder(url)
                    .timeout(cfg.getTimeout())
                    .header("User-Agent", cfg.getUserAgent())
                    .header("Accept", "text/html,application/xhtml+xml,application/xml;q=0.9,*/*;q=0.8")
                    .GET()
                    .build();
        } catch (IllegalArgumentException e) {
            throw new FetchException(url, "Unsupported URL: " + url, e);
        }

        HttpResponse<String> res;
        try {
            res = sender.send(req);
        } catch (IOException e) {
            throw new FetchException(url, "Request failed for " + url + ": " + e, e);
        }

        int code = res.statusCode();
        if (code < 200 || code >= 300) {
            throw FetchException.badStatus(url, code);
        }
        String contentType = res.headers().firstValue("Content-Type").orElse(null);
        URI finalUri = (res.uri() != null ? res.uri() : url);
        return new FetchedPage(url, finalUri, code, contentType, res.body());
    }
}
