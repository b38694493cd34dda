package com.sitemapper.core.crawler;

/** 디바운스 경과 시간 측정용 시계 (테스트에서 고정 시계 주입) */
@FunctionalInterface
public interface CrawlClock {
    long nowMillis();

    CrawlClock SYSTEM = () -> System.nanoTime() / 1_000_000L;
}
