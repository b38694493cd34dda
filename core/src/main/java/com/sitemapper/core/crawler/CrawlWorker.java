package com.sitemapper.core.crawler;

import com.sitemapper.core.model.WorkerStatus;
import com.sitemapper.core.util.CrawlEventLog;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.BlockingQueue;
import java.util.concurrent.TimeUnit;

/**
 * Fetch/Index 워커 공통 루프. 상태: Idle → Busy → ... → Terminated
 *
 * 매 반복:
 *  - 입력 큐에서 짧게 대기(poll) → 항목이 있으면 Busy 보고(전이 시에만) 후 처리
 *  - 항목이 없으면 종료 신호 확인 → 있으면 종료, 없으면 Idle 보고(전이 시에만)
 *
 * 항목 하나에서 난 RuntimeException 은 그 항목만 실패시키고 루프는 계속된다.
 * 종료 배리어 감소는 finally 에서 보장한다.
 */
abstract class CrawlWorker<T> implements Runnable {

    private static final Logger LOG = LoggerFactory.getLogger(CrawlWorker.class);
    private static final CrawlEventLog SLOG = CrawlEventLog.of(CrawlWorker.class);

    protected final int id;
    protected final CrawlContext ctx;
    private final BlockingQueue<T> input;
    private final long pollMs;

    private boolean busy = false;
    private boolean reported = false; // 첫 보고 여부

    CrawlWorker(int id, CrawlContext ctx, BlockingQueue<T> input) {
        this.id = id;
        this.ctx = ctx;
        this.input = input;
        this.pollMs = Math.max(1, ctx.config.getPollInterval().toMillis());
    }

    /** 항목 하나 처리. 후속 작업을 큐에 넣기 전에는 반드시 ctx.workAdded() */
    protected abstract void process(T item) throws InterruptedException;

    /** 로그용 워커 종류 */
    protected abstract String kind();

    @Override
    public final void run() {
        try {
            loop();
        } finally {
            ctx.completion.countDown();
            LOG.debug("[{}-{}] exited", kind(), id);
        }
    }

    private void loop() {
        while (true) {
            T item;
            try {
                item = input.poll(pollMs, TimeUnit.MILLISECONDS);
            } catch (InterruptedException ie) {
                Thread.currentThread().interrupt();
                return;
            }

            if (item != null) {
                if (!report(true)) return;
                ctx.stats.workStarted();
                try {
                    process(item);
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    return;
                } catch (RuntimeException e) {
                    ctx.stats.workerError();
                    LOG.warn("[{}-{}] failed on {}: {}", kind(), id, item, e.toString());
                    SLOG.error("worker-error", e, "worker", id, "kind", kind(), "item", String.valueOf(item));
                } finally {
                    ctx.stats.workEnded();
                    ctx.workDone();
                }
                continue;
            }

            if (ctx.termination.observe()) return;
            if (!report(false)) return;
        }
    }

    /**
     * 상태가 바뀌었을 때만(또는 첫 보고) 모니터에 알린다.
     * @return 인터럽트되면 false
     */
    private boolean report(boolean nowBusy) {
        if (reported && busy == nowBusy) return true;
        busy = nowBusy;
        reported = true;
        if (!ctx.reportsStatus() || ctx.termination.isFired()) return true;
        try {
            ctx.statuses.put(new WorkerStatus(id, nowBusy));
            return true;
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            return false;
        }
    }
}
