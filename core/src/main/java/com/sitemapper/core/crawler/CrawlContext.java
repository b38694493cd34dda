package com.sitemapper.core.crawler;

import com.sitemapper.core.model.CrawlConfig;
import com.sitemapper.core.model.CrawlStats;
import com.sitemapper.core.model.Page;
import com.sitemapper.core.model.TerminationMode;
import com.sitemapper.core.model.WorkerStatus;

import java.net.URI;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.atomic.AtomicLong;

/**
 * 한 번의 크롤에서 워커/모니터가 공유하는 상태 묶음.
 * 데이터 흐름: requests → FetchWorker → pages → IndexWorker → (SiteMap) → requests
 */
final class CrawlContext {
    final CrawlConfig config;
    final SiteMap siteMap;
    final CrawlStats stats;

    final BlockingQueue<URI> requests;
    final BlockingQueue<Page> pages;
    final BlockingQueue<WorkerStatus> statuses;

    final TerminationSignal termination;
    final CountDownLatch completion;   // 워커 종료마다 1 감소

    /** 큐에 들어갔거나 처리 중인 항목 수. 0 이면 더 만들어질 일이 없다. */
    private final AtomicLong outstanding = new AtomicLong(0);

    CrawlContext(CrawlConfig config, SiteMap siteMap, CrawlStats stats) {
        this.config = config;
        this.siteMap = siteMap;
        this.stats = stats;

        int reqCap = config.getRequestQueueCapacity();
        this.requests = (reqCap > 0) ? new ArrayBlockingQueue<>(reqCap) : new LinkedBlockingQueue<>();
        this.pages = new ArrayBlockingQueue<>(config.getPageQueueCapacity());
        this.statuses = new ArrayBlockingQueue<>(config.getStatusQueueCapacity());

        int workers = config.getTotalWorkers();
        this.termination = new TerminationSignal(workers);
        this.completion = new CountDownLatch(workers);
    }

    int totalWorkers() {
        return config.getTotalWorkers();
    }

    /** enqueue 직전에 호출 (카운터가 잠깐이라도 0으로 보이지 않게) */
    void workAdded() {
        outstanding.incrementAndGet();
    }

    /** 항목 하나의 처리가 끝났을 때 (후속 enqueue는 이미 workAdded로 반영됨) */
    void workDone() {
        outstanding.decrementAndGet();
    }

    long outstandingWork() {
        return outstanding.get();
    }

    /** 상태 보고는 디바운스 모드에서만 필요 */
    boolean reportsStatus() {
        return config.getTerminationMode() == TerminationMode.DEBOUNCE;
    }
}
