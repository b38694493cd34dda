package com.sitemapper.core.crawler;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 1회성 종료 브로드캐스트. fire()는 최초 1회만 유효하고,
 * 각 워커는 종료 직전에 observe()로 한 번 확인한다.
 */
public final class TerminationSignal {
    private final int expectedObservers;
    private final AtomicBoolean fired = new AtomicBoolean(false);
    private final CountDownLatch latch = new CountDownLatch(1);
    private final AtomicInteger observed = new AtomicInteger(0);

    public TerminationSignal(int expectedObservers) {
        this.expectedObservers = expectedObservers;
    }

    /** @return 이번 호출이 실제로 신호를 보냈으면 true */
    public boolean fire() {
        if (!fired.compareAndSet(false, true)) return false;
        latch.countDown();
        return true;
    }

    public boolean isFired() {
        return fired.get();
    }

    /** 워커가 종료를 확인하는 지점. 신호가 있으면 관측 수를 올리고 true */
    boolean observe() {
        if (!fired.get()) return false;
        observed.incrementAndGet();
        return true;
    }

    public boolean await(long timeout, TimeUnit unit) throws InterruptedException {
        return latch.await(timeout, unit);
    }

    public int observedCount() { return observed.get(); }

    public int expectedObservers() { return expectedObservers; }
}
