package com.sitemapper.core.model;

import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/** 크롤 런타임 카운터 누적기 (스레드 세이프). */
public final class CrawlStats {
    private final AtomicLong fetched              = new AtomicLong(0); // fetch 성공
    private final AtomicLong fetchFailures        = new AtomicLong(0); // 네트워크 오류/비-2xx
    private final AtomicLong parseFailures        = new AtomicLong(0); // 파서 예외 → 빈 결과 처리
    private final AtomicLong indexed              = new AtomicLong(0); // 사이트맵 저장
    private final AtomicLong linksEnqueued        = new AtomicLong(0); // 새로 발견되어 요청 큐로
    private final AtomicLong duplicatesSuppressed = new AtomicLong(0); // 이미 선점된 경로
    private final AtomicLong crossHostDropped     = new AtomicLong(0); // 다른 host 링크 폐기
    private final AtomicLong workerErrors         = new AtomicLong(0); // 작업 단위 예기치 못한 예외
    private final AtomicInteger busyWorkers       = new AtomicInteger(0);
    private final AtomicInteger maxObservedBusy   = new AtomicInteger(0);

    public void fetched()              { fetched.incrementAndGet(); }
    public void fetchFailed()          { fetchFailures.incrementAndGet(); }
    public void parseFailed()          { parseFailures.incrementAndGet(); }
    public void indexed()              { indexed.incrementAndGet(); }
    public void linkEnqueued()         { linksEnqueued.incrementAndGet(); }
    public void duplicateSuppressed()  { duplicatesSuppressed.incrementAndGet(); }
    public void crossHostDropped(long n) { if (n > 0) crossHostDropped.addAndGet(n); }
    public void workerError()          { workerErrors.incrementAndGet(); }

    /** 작업 시작 시 호출: 동시 busy 워커 수 최대값 갱신 */
    public void workStarted() {
        int cur = busyWorkers.incrementAndGet();
        maxObservedBusy.accumulateAndGet(cur, Math::max);
    }

    public void workEnded() {
        busyWorkers.decrementAndGet();
    }

    public Snapshot snapshot() {
        return new Snapshot(
                fetched.get(), fetchFailures.get(), parseFailures.get(), indexed.get(),
                linksEnqueued.get(), duplicatesSuppressed.get(), crossHostDropped.get(),
                workerErrors.get(), maxObservedBusy.get());
    }

    /** 불변 스냅샷 DTO */
    public record Snapshot(
            long fetched,
            long fetchFailures,
            long parseFailures,
            long indexed,
            long linksEnqueued,
            long duplicatesSuppressed,
            long crossHostDropped,
            long workerErrors,
            int maxObservedBusyWorkers
    ) {
        public static final Snapshot EMPTY = new Snapshot(0, 0, 0, 0, 0, 0, 0, 0, 0);
    }
}
