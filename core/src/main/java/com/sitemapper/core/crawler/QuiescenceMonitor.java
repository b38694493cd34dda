package com.sitemapper.core.crawler;

import com.sitemapper.core.model.TerminationMode;
import com.sitemapper.core.model.WorkerStatus;
import com.sitemapper.core.util.CrawlEventLog;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;

/**
 * 종료 판정 루프 (크롤당 1개).
 *
 * WORK_COUNTER: 미처리 작업 카운터가 0이 되는 즉시 종료.
 * DEBOUNCE: 워커별 최신 상태표가 "전원 등록 + 전원 Idle" 을 디바운스 시간 이상 유지하면 종료.
 *           그 사이 한 번이라도 Busy 가 보이면 잠정 플래그를 지운다.
 *
 * 상태표는 이 클래스만 읽고 쓴다.
 */
final class QuiescenceMonitor implements Runnable {

    private static final Logger LOG = LoggerFactory.getLogger(QuiescenceMonitor.class);
    private static final CrawlEventLog SLOG = CrawlEventLog.of(QuiescenceMonitor.class);

    private final CrawlContext ctx;
    private final CrawlClock clock;
    private final long debounceMs;
    private final long intervalMs;

    private final Map<Integer, Boolean> table = new HashMap<>(); // workerId → busy
    private boolean tentative = false;
    private long tentativeSince = 0L;

    QuiescenceMonitor(CrawlContext ctx, CrawlClock clock) {
        this.ctx = ctx;
        this.clock = (clock != null) ? clock : CrawlClock.SYSTEM;
        this.debounceMs = ctx.config.getDebounce().toMillis();
        this.intervalMs = Math.max(1, ctx.config.getMonitorInterval().toMillis());
    }

    @Override
    public void run() {
        LOG.debug("Monitor start: mode={}, workers={}", ctx.config.getTerminationMode(), ctx.totalWorkers());
        try {
            while (!ctx.termination.isFired()) {
                // 보고가 오면 바로 깨고, 없으면 intervalMs 후 재평가
                WorkerStatus head = ctx.statuses.poll(intervalMs, TimeUnit.MILLISECONDS);
                if (head != null) apply(head);
                if (cycle()) return;
            }
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            LOG.debug("Monitor interrupted");
        }
    }

    /**
     * 한 사이클: 대기 중인 보고를 전부 반영하고 종료 조건을 평가한다.
     * @return 이번 사이클에서 종료를 선언했으면 true
     */
    boolean cycle() {
        List<WorkerStatus> pending = new ArrayList<>();
        ctx.statuses.drainTo(pending);
        for (WorkerStatus s : pending) apply(s);

        boolean done = (ctx.config.getTerminationMode() == TerminationMode.DEBOUNCE)
                ? debounced()
                : ctx.outstandingWork() == 0;
        if (!done) return false;

        if (ctx.termination.fire()) {
            LOG.info("Termination declared (mode={}, sitemapSize={})",
                    ctx.config.getTerminationMode(), ctx.siteMap.size());
            SLOG.info("termination-declared",
                    "mode", String.valueOf(ctx.config.getTerminationMode()),
                    "sitemapSize", ctx.siteMap.size());
        }
        return true;
    }

    private void apply(WorkerStatus s) {
        table.put(s.workerId(), s.busy());
    }

    private boolean debounced() {
        if (!allIdle()) {
            if (tentative) LOG.debug("Quiescence cleared: a worker turned busy");
            tentative = false;
            return false;
        }
        long now = clock.nowMillis();
        if (!tentative) {
            tentative = true;
            tentativeSince = now;
            SLOG.debug("quiescence-tentative", "workers", table.size());
            return false;
        }
        return now - tentativeSince >= debounceMs;
    }

    /** 모든 워커가 한 번 이상 보고했고 전원 Idle */
    private boolean allIdle() {
        if (table.size() < ctx.totalWorkers()) return false;
        for (Boolean busy : table.values()) {
            if (busy) return false;
        }
        return true;
    }

    boolean isTentative() { return tentative; }

    int reportedWorkers() { return table.size(); }
}
