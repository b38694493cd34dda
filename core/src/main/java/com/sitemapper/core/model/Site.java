package com.sitemapper.core.model;

import java.net.URI;
import java.util.Collections;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeMap;

/**
 * 크롤 완료 후 호출자에게 넘기는 읽기 전용 사이트맵 스냅샷.
 * 키 = 정규화 경로, 경로 순 정렬.
 */
public final class Site {
    private final URI domain;
    private final Map<String, Page> pages;

    public Site(URI domain, Map<String, Page> pages) {
        this.domain = Objects.requireNonNull(domain, "domain");
        this.pages = Collections.unmodifiableMap(new TreeMap<>(pages == null ? Map.of() : pages));
    }

    public URI getDomain() { return domain; }

    public Map<String, Page> getPages() { return pages; }

    public Set<String> paths() { return pages.keySet(); }

    public Page page(String path) { return pages.get(path); }

    public int size() { return pages.size(); }

    /** fetch에 실패해 자리만 남은 경로 수 */
    public long placeholderCount() {
        return pages.values().stream().filter(Page::placeholder).count();
    }

    @Override public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Site other)) return false;
        return domain.equals(other.domain) && pages.equals(other.pages);
    }

    @Override public int hashCode() { return Objects.hash(domain, pages); }

    @Override public String toString() {
        return "Site{" + domain + ", pages=" + pages.size() + "}";
    }
}
