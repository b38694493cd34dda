package com.sitemapper.core.crawler;

import com.sitemapper.core.model.Page;
import com.sitemapper.core.model.Site;
import com.sitemapper.core.util.UrlUtils;

import java.net.URI;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.locks.ReentrantLock;

/**
 * 크롤 중 공유되는 유일한 가변 구조.
 * 맵 자체는 노출하지 않고 원자 연산(claim/store/snapshot)만 제공한다.
 * 모든 임계구역은 한 번의 락 획득으로 끝나며, 락을 쥔 채 큐에 넣는 일은 없다.
 */
public final class SiteMap {
    private final URI domain;
    private final Map<String, Page> pages = new HashMap<>();
    private final ReentrantLock lock = new ReentrantLock();

    public SiteMap(URI domain) {
        this.domain = Objects.requireNonNull(domain, "domain");
    }

    public URI getDomain() { return domain; }

    /**
     * 경로가 비어 있으면 placeholder를 넣고 true.
     * 존재 확인과 삽입이 같은 임계구역 → 두 인덱서가 동시에 "새 링크"로 판단할 수 없다.
     */
    public boolean claim(URI url) {
        String key = UrlUtils.pathKey(url);
        lock.lock();
        try {
            if (pages.containsKey(key)) return false;
            pages.put(key, Page.placeholder(url));
            return true;
        } finally {
            lock.unlock();
        }
    }

    /** 실제 페이지 저장(placeholder 덮어쓰기) */
    public void store(Page page) {
        Objects.requireNonNull(page, "page");
        String key = UrlUtils.pathKey(page.url());
        lock.lock();
        try {
            pages.put(key, page);
        } finally {
            lock.unlock();
        }
    }

    public int size() {
        lock.lock();
        try {
            return pages.size();
        } finally {
            lock.unlock();
        }
    }

    /** 읽기 전용 복사본 */
    public Site snapshot() {
        lock.lock();
        try {
            return new Site(domain, pages);
        } finally {
            lock.unlock();
        }
    }
}
