package com.sitemapper.core.crawler;

import com.sitemapper.core.api.IPageFetcher;
import com.sitemapper.core.api.IPageParser;
import com.sitemapper.core.http.FetchException;
import com.sitemapper.core.model.FetchedPage;
import com.sitemapper.core.model.Page;
import com.sitemapper.core.model.ParseResult;
import com.sitemapper.core.util.CrawlEventLog;
import com.sitemapper.core.util.UrlUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.util.ArrayList;
import java.util.List;

/**
 * 요청 큐의 URL을 fetch → 파싱 → Page 생성 → 페이지 큐로.
 * fetch 실패 URL은 로그만 남기고 버린다(재시도 없음).
 * 페이지 큐가 가득 차면 put 에서 대기한다(역압). 성공한 페이지는 버리지 않는다.
 */
final class FetchWorker extends CrawlWorker<URI> {

    private static final Logger LOG = LoggerFactory.getLogger(FetchWorker.class);
    private static final CrawlEventLog SLOG = CrawlEventLog.of(FetchWorker.class);

    private final IPageFetcher fetcher;
    private final IPageParser parser;

    FetchWorker(int id, CrawlContext ctx, IPageFetcher fetcher, IPageParser parser) {
        super(id, ctx, ctx.requests);
        this.fetcher = fetcher;
        this.parser = parser;
    }

    @Override
    protected String kind() { return "fetch"; }

    @Override
    protected void process(URI url) throws InterruptedException {
        FetchedPage response;
        try {
            response = fetcher.fetch(url);
        } catch (FetchException e) {
            ctx.stats.fetchFailed();
            LOG.warn("[{}] request failed for URL: {} ({})", id, url, e.getMessage());
            SLOG.warn("fetch-failed", "worker", id, "url", String.valueOf(url), "status", e.getStatusCode());
            return;
        }
        ctx.stats.fetched();
        LOG.info("[{}] requested {}", id, url);

        ParseResult parsed = parseQuietly(url, response);
        Page page = Page.of(url, sameHostOnly(parsed.links()), parsed.assets());
        SLOG.info("page-fetched", "worker", id, "url", String.valueOf(url),
                "links", page.links().size(), "assets", page.assets().size());

        ctx.workAdded();
        ctx.pages.put(page);
    }

    /** 파서 예외는 빈 결과 */
    private ParseResult parseQuietly(URI url, FetchedPage response) {
        try {
            ParseResult r = parser.parse(response);
            return (r != null) ? r : ParseResult.EMPTY;
        } catch (RuntimeException e) {
            ctx.stats.parseFailed();
            LOG.warn("[{}] parse failed for {}: {}", id, url, e.toString());
            return ParseResult.EMPTY;
        }
    }

    /** 사이트 도메인과 다른 host 링크는 Page 생성 전에 제거 (리다이렉트로 host가 바뀐 경우 포함) */
    private List<URI> sameHostOnly(List<URI> links) {
        URI domain = ctx.siteMap.getDomain();
        List<URI> out = new ArrayList<>(links.size());
        for (URI link : links) {
            if (UrlUtils.sameHost(domain, link)) out.add(link);
        }
        ctx.stats.crossHostDropped(links.size() - out.size());
        return out;
    }
}
