package com.sitemapper.core.crawler;

import com.sitemapper.core.model.Page;
import com.sitemapper.core.util.CrawlEventLog;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.util.ArrayList;
import java.util.List;

/**
 * 페이지 큐의 Page를 사이트맵에 저장하고, 처음 보는 같은 host 링크를 요청 큐로 돌려보낸다.
 *
 * 링크마다 claim() 한 번(확인+placeholder 삽입이 한 임계구역)으로 중복 fetch를 막는다.
 * 요청 큐 put 은 모든 claim 이 끝나 락을 놓은 뒤에만 한다.
 */
final class IndexWorker extends CrawlWorker<Page> {

    private static final Logger LOG = LoggerFactory.getLogger(IndexWorker.class);
    private static final CrawlEventLog SLOG = CrawlEventLog.of(IndexWorker.class);

    IndexWorker(int id, CrawlContext ctx) {
        super(id, ctx, ctx.pages);
    }

    @Override
    protected String kind() { return "index"; }

    @Override
    protected void process(Page page) throws InterruptedException {
        SiteMap site = ctx.siteMap;
        site.store(page);
        ctx.stats.indexed();
        LOG.info("[{}] indexed {}", id, page.url());

        int cap = ctx.config.getMaxLinksPerPage();
        List<URI> fresh = new ArrayList<>();
        for (URI link : page.links()) {
            if (cap > 0 && fresh.size() >= cap) {
                LOG.debug("[{}] link cap {} reached on {}", id, cap, page.url());
                break;
            }
            if (site.claim(link)) {
                fresh.add(link);
            } else {
                ctx.stats.duplicateSuppressed();
            }
        }

        for (URI link : fresh) {
            ctx.workAdded();
            ctx.requests.put(link);
            ctx.stats.linkEnqueued();
        }
        SLOG.info("page-indexed", "worker", id, "url", String.valueOf(page.url()),
                "newLinks", fresh.size(), "sitemapSize", site.size());
    }
}
