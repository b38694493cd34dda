package com.sitemapper.core.crawler;

import com.sitemapper.core.model.CrawlConfig;
import com.sitemapper.core.model.CrawlStats;
import com.sitemapper.core.model.TerminationMode;
import com.sitemapper.core.model.WorkerStatus;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.net.URI;
import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("QuiescenceMonitor — 디바운스/카운터 종료 판정")
class QuiescenceMonitorTest {

    private static CrawlContext context(TerminationMode mode) {
        CrawlConfig cfg = CrawlConfig.defaults()
                .setWorkers(1, 1)
                .setTerminationMode(mode)
                .setDebounce(Duration.ofMillis(2000));
        return new CrawlContext(cfg, new SiteMap(URI.create("http://example.com/")), new CrawlStats());
    }

    @Test
    @DisplayName("보고가 전혀 없으면 잠정 종료도 없다")
    void noReports_notQuiescent() {
        CrawlContext ctx = context(TerminationMode.DEBOUNCE);
        QuiescenceMonitor m = new QuiescenceMonitor(ctx, new FrozenClock(0));

        assertFalse(m.cycle());
        assertFalse(m.isTentative());
        assertFalse(ctx.termination.isFired());
    }

    @Test
    @DisplayName("일부 워커만 Idle 보고 → 표가 다 차지 않아 잠정 종료 아님")
    void partialTable_notQuiescent() {
        CrawlContext ctx = context(TerminationMode.DEBOUNCE);
        QuiescenceMonitor m = new QuiescenceMonitor(ctx, new FrozenClock(0));

        ctx.statuses.add(WorkerStatus.idle(0));
        assertFalse(m.cycle());
        assertEquals(1, m.reportedWorkers());
        assertFalse(m.isTentative());
    }

    @Test
    @DisplayName("전원 Idle 이 디바운스 시간 이상 유지되면 종료 선언")
    void allIdle_debounceElapsed_terminates() {
        CrawlContext ctx = context(TerminationMode.DEBOUNCE);
        FrozenClock clock = new FrozenClock(10_000);
        QuiescenceMonitor m = new QuiescenceMonitor(ctx, clock);

        ctx.statuses.add(WorkerStatus.idle(0));
        ctx.statuses.add(WorkerStatus.idle(1));
        assertFalse(m.cycle());
        assertTrue(m.isTentative());

        clock.plusMillis(1999);
        assertFalse(m.cycle());
        assertFalse(ctx.termination.isFired());

        clock.plusMillis(1);
        assertTrue(m.cycle());
        assertTrue(ctx.termination.isFired());
    }

    @Test
    @DisplayName("잠정 종료 중 Busy 가 보이면 플래그 해제, 다시 Idle 이면 시간을 새로 잰다")
    void busyResetsTentative() {
        CrawlContext ctx = context(TerminationMode.DEBOUNCE);
        FrozenClock clock = new FrozenClock(0);
        QuiescenceMonitor m = new QuiescenceMonitor(ctx, clock);

        ctx.statuses.add(WorkerStatus.idle(0));
        ctx.statuses.add(WorkerStatus.idle(1));
        m.cycle();
        assertTrue(m.isTentative());

        clock.plusMillis(1500);
        ctx.statuses.add(WorkerStatus.busy(1));
        assertFalse(m.cycle());
        assertFalse(m.isTentative());

        ctx.statuses.add(WorkerStatus.idle(1));
        assertFalse(m.cycle());          // 새 잠정 시작 (t=1500)
        clock.plusMillis(1000);
        assertFalse(m.cycle());          // 1000ms 경과: 아직
        clock.plusMillis(1000);
        assertTrue(m.cycle());           // 2000ms 경과
    }

    @Test
    @DisplayName("같은 사이클에 Busy→Idle 이 모두 도착하면 최신 상태(Idle)만 반영")
    void latestStatusWins() {
        CrawlContext ctx = context(TerminationMode.DEBOUNCE);
        QuiescenceMonitor m = new QuiescenceMonitor(ctx, new FrozenClock(0));

        ctx.statuses.add(WorkerStatus.busy(0));
        ctx.statuses.add(WorkerStatus.idle(0));
        ctx.statuses.add(WorkerStatus.idle(1));
        m.cycle();
        assertTrue(m.isTentative());
    }

    @Test
    @DisplayName("WORK_COUNTER: 미처리 작업이 0 이 되는 순간 종료, 신호는 한 번만")
    void workCounter_terminatesAtZero() {
        CrawlContext ctx = context(TerminationMode.WORK_COUNTER);
        QuiescenceMonitor m = new QuiescenceMonitor(ctx, new FrozenClock(0));

        ctx.workAdded();
        ctx.workAdded();
        assertFalse(m.cycle());
        ctx.workDone();
        assertFalse(m.cycle());
        ctx.workDone();
        assertTrue(m.cycle());
        assertTrue(ctx.termination.isFired());

        assertFalse(ctx.termination.fire()); // 이미 발사됨
    }

    @Test
    @DisplayName("WORK_COUNTER 모드는 상태 보고를 무시한다")
    void workCounter_ignoresStatusTable() {
        CrawlContext ctx = context(TerminationMode.WORK_COUNTER);
        QuiescenceMonitor m = new QuiescenceMonitor(ctx, new FrozenClock(0));
        ctx.workAdded();

        ctx.statuses.add(WorkerStatus.idle(0));
        ctx.statuses.add(WorkerStatus.idle(1));
        assertFalse(m.cycle());
        assertFalse(ctx.reportsStatus());
    }

    @Test
    @DisplayName("run(): 백그라운드 루프가 카운터 0 을 보고 종료 신호 발사")
    void run_firesSignal() throws Exception {
        CrawlContext ctx = context(TerminationMode.WORK_COUNTER);
        Thread t = new Thread(new QuiescenceMonitor(ctx, CrawlClock.SYSTEM), "test-monitor");
        t.setDaemon(true);
        t.start();

        assertTrue(ctx.termination.await(5, java.util.concurrent.TimeUnit.SECONDS));
        t.join(5000);
        assertFalse(t.isAlive());
    }
}
