package com.sitemapper.core.crawler;

import com.sitemapper.core.api.IPageFetcher;
import com.sitemapper.core.api.IPageParser;
import com.sitemapper.core.http.HttpPageFetcher;
import com.sitemapper.core.model.CrawlConfig;
import com.sitemapper.core.model.CrawlStats;
import com.sitemapper.core.model.Site;
import com.sitemapper.core.util.CrawlEventLog;
import com.sitemapper.core.util.UrlUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 크롤 진입점.
 *  - 시드 검증(실패 시 스레드를 하나도 띄우지 않고 InvalidSeedException)
 *  - 큐/종료 신호/완료 배리어 생성 → 시드 투입
 *  - Fetch 워커 N, Index 워커 M, 모니터 1 기동
 *  - 모든 워커가 빠져나올 때까지 대기 후 불변 Site 반환
 *
 * 인스턴스는 재사용 가능하다(크롤마다 상태를 새로 만든다). 단, 동시에 두 번 crawl() 하지는 않는다.
 */
public final class CrawlDispatcher {

    private static final Logger LOG = LoggerFactory.getLogger(CrawlDispatcher.class);
    private static final CrawlEventLog SLOG = CrawlEventLog.of(CrawlDispatcher.class);

    private final CrawlConfig config;
    private final IPageFetcher fetcher;
    private final IPageParser parser;
    private final CrawlClock clock;

    private volatile CrawlStats lastStats = new CrawlStats();
    private volatile TerminationSignal lastTermination;

    /** 기본 구현: HttpClient + jsoup */
    public CrawlDispatcher(CrawlConfig config) {
        this(config, new HttpPageFetcher(config), new JsoupPageParser(config.getDefaultScheme()));
    }

    /** DI/테스트용 */
    public CrawlDispatcher(CrawlConfig config, IPageFetcher fetcher, IPageParser parser) {
        this(config, fetcher, parser, CrawlClock.SYSTEM);
    }

    public CrawlDispatcher(CrawlConfig config, IPageFetcher fetcher, IPageParser parser, CrawlClock clock) {
        this.config = Objects.requireNonNull(config, "config");
        this.fetcher = Objects.requireNonNull(fetcher, "fetcher");
        this.parser = Objects.requireNonNull(parser, "parser");
        this.clock = (clock != null) ? clock : CrawlClock.SYSTEM;
    }

    /** 설정의 seed 로 크롤 */
    public Site crawl() {
        return crawl(config.getSeed());
    }

    /**
     * @throws InvalidSeedException 시드를 URL로 해석할 수 없을 때 (워커 기동 전)
     * @throws IllegalArgumentException 설정이 잘못됐을 때
     * @throws CancellationException 대기 중 호출 스레드가 인터럽트됐을 때
     */
    public Site crawl(String seed) {
        config.validate();
        URI root = parseSeed(seed, config.getDefaultScheme());

        SiteMap siteMap = new SiteMap(root);
        CrawlStats stats = new CrawlStats();
        CrawlContext ctx = new CrawlContext(config, siteMap, stats);
        this.lastStats = stats;
        this.lastTermination = ctx.termination;

        LOG.info("Crawl start: seed={}, fetchWorkers={}, indexWorkers={}, mode={}",
                root, config.getFetchWorkers(), config.getIndexWorkers(), config.getTerminationMode());
        SLOG.info("crawl-start",
                "seed", root.toString(),
                "fetchWorkers", config.getFetchWorkers(),
                "indexWorkers", config.getIndexWorkers(),
                "mode", String.valueOf(config.getTerminationMode()));
        long t0 = System.nanoTime();

        siteMap.claim(root);
        ctx.workAdded();
        ctx.requests.add(root); // 비어 있는 새 큐라 용량 초과 없음

        List<Thread> threads = start(ctx);
        try {
            ctx.completion.await();
        } catch (InterruptedException ie) {
            ctx.termination.fire();
            threads.forEach(Thread::interrupt);
            Thread.currentThread().interrupt();
            LOG.warn("Crawl interrupted: seed={}", root);
            throw new CancellationException("Interrupted while crawling " + root);
        }

        Site site = siteMap.snapshot();
        long ms = (System.nanoTime() - t0) / 1_000_000L;
        CrawlStats.Snapshot s = stats.snapshot();
        LOG.info("Crawl done. pages={}, fetched={}, fetchFailures={}, elapsedMs={}",
                site.size(), s.fetched(), s.fetchFailures(), ms);
        SLOG.info("crawl-done",
                "pages", site.size(),
                "fetched", s.fetched(),
                "fetchFailures", s.fetchFailures(),
                "workerErrors", s.workerErrors(),
                "observedTermination", ctx.termination.observedCount(),
                "elapsedMs", ms);
        return site;
    }

    private List<Thread> start(CrawlContext ctx) {
        List<Thread> threads = new ArrayList<>(ctx.totalWorkers() + 1);
        ThreadFactory fetchTf = new NamedThreadFactory("fetch-worker");
        ThreadFactory indexTf = new NamedThreadFactory("index-worker");

        int n = config.getFetchWorkers();
        int m = config.getIndexWorkers();
        // id: fetch 0..n-1, index n..n+m-1
        for (int i = 0; i < n; i++) {
            threads.add(fetchTf.newThread(new FetchWorker(i, ctx, fetcher, parser)));
        }
        for (int i = 0; i < m; i++) {
            threads.add(indexTf.newThread(new IndexWorker(n + i, ctx)));
        }
        threads.add(new NamedThreadFactory("crawl-monitor").newThread(new QuiescenceMonitor(ctx, clock)));

        threads.forEach(Thread::start);
        return threads;
    }

    /** 기본 scheme 보정 후 정규화. host 가 없으면 잘못된 시드 */
    static URI parseSeed(String seed, String defaultScheme) {
        if (seed == null || seed.isBlank()) throw new InvalidSeedException(seed, "Seed URL is empty");
        String fixed = UrlUtils.withDefaultScheme(seed, defaultScheme);
        URI u;
        try {
            u = new URI(fixed);
        } catch (URISyntaxException e) {
            throw new InvalidSeedException(seed, "Malformed seed URL: " + seed, e);
        }
        if (u.getHost() == null || u.getHost().isBlank() || !UrlUtils.isHttpLike(u)) {
            throw new InvalidSeedException(seed, "Malformed seed URL: " + seed);
        }
        return UrlUtils.normalize(u);
    }

    /** 마지막 crawl() 의 통계 */
    public CrawlStats.Snapshot getStats() {
        return lastStats.snapshot();
    }

    /** 마지막 crawl() 의 종료 신호 (관측 수 확인용) */
    TerminationSignal lastTermination() {
        return lastTermination;
    }

    public CrawlConfig getConfig() { return config; }

    static final class NamedThreadFactory implements ThreadFactory {
        private final String prefix;
        private final AtomicInteger seq = new AtomicInteger(1);
        NamedThreadFactory(String prefix) { this.prefix = prefix; }
        @Override public Thread newThread(Runnable r) {
            Thread t = new Thread(r, prefix + "-" + seq.getAndIncrement());
            t.setDaemon(true);
            return t;
        }
    }
}
