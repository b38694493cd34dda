package com.sitemapper.core.model;

import java.time.Duration;
import java.util.Objects;

/**
 * 크롤 설정 (crawl.yml 매핑 대상). 순수 설정 보관용.
 * 기본값은 워커 10/10, 페이지 큐 400, 디바운스 2초.
 */
public final class CrawlConfig {

    /** HTTP 관련 하위 설정: YAML의 `http:` 섹션과 매핑 */
    public static final class HttpCfg {
        private Duration timeout = Duration.ofSeconds(10);        // 요청 타임아웃
        private Duration connectTimeout = Duration.ofSeconds(5);
        private boolean followRedirects = true;
        private String userAgent = "SiteMapper/0.1 (+crawler)";

        public Duration getTimeout() { return timeout; }
        public HttpCfg setTimeout(Duration timeout) { this.timeout = timeout; return this; }

        public Duration getConnectTimeout() { return connectTimeout; }
        public HttpCfg setConnectTimeout(Duration connectTimeout) { this.connectTimeout = connectTimeout; return this; }

        public boolean isFollowRedirects() { return followRedirects; }
        public HttpCfg setFollowRedirects(boolean followRedirects) { this.followRedirects = followRedirects; return this; }

        public String getUserAgent() { return userAgent; }
        public HttpCfg setUserAgent(String userAgent) {
            if (userAgent != null && !userAgent.isBlank()) this.userAgent = userAgent;
            return this;
        }
    }

    // ---------- 기본 필드 ----------
    private String seed;                      // 시작 URL (CLI 인자로 덮어쓸 수 있음)
    private String defaultScheme = "http";

    private int fetchWorkers = 10;
    private int indexWorkers = 10;

    /** 0 이하면 무제한(점진 확장) 요청 큐 */
    private int requestQueueCapacity = 0;
    private int pageQueueCapacity = 400;
    /** 0 이하면 8 × 전체 워커 수 */
    private int statusQueueCapacity = 0;

    private TerminationMode terminationMode = TerminationMode.WORK_COUNTER;
    private Duration debounce = Duration.ofSeconds(2);
    private Duration pollInterval = Duration.ofMillis(50);    // 워커 큐 대기 상한
    private Duration monitorInterval = Duration.ofMillis(10); // 모니터 사이클 대기 상한

    /** 페이지당 요청 큐에 넣을 새 링크 상한 (0 = 무제한) */
    private int maxLinksPerPage = 0;

    /** YAML `http:` 섹션 매핑 */
    private HttpCfg http = new HttpCfg();

    // ---------- getters ----------
    public String getSeed() { return seed; }
    public String getDefaultScheme() { return defaultScheme; }
    public int getFetchWorkers() { return fetchWorkers; }
    public int getIndexWorkers() { return indexWorkers; }
    public int getTotalWorkers() { return fetchWorkers + indexWorkers; }
    public int getRequestQueueCapacity() { return requestQueueCapacity; }
    public int getPageQueueCapacity() { return pageQueueCapacity; }
    public TerminationMode getTerminationMode() { return terminationMode; }
    public Duration getDebounce() { return debounce; }
    public Duration getPollInterval() { return pollInterval; }
    public Duration getMonitorInterval() { return monitorInterval; }
    public int getMaxLinksPerPage() { return maxLinksPerPage; }
    public HttpCfg getHttp() { return http; }

    /** 설정값이 없으면 원래 크롤러와 같은 8 × 워커 수 */
    public int getStatusQueueCapacity() {
        return statusQueueCapacity > 0 ? statusQueueCapacity : getTotalWorkers() * 8;
    }

    // ---------- fluent setters ----------
    public CrawlConfig setSeed(String seed) { this.seed = seed; return this; }
    public CrawlConfig setDefaultScheme(String scheme) {
        if (scheme != null && !scheme.isBlank()) this.defaultScheme = scheme.trim();
        return this;
    }
    public CrawlConfig setFetchWorkers(int n) { this.fetchWorkers = n; return this; }
    public CrawlConfig setIndexWorkers(int n) { this.indexWorkers = n; return this; }
    public CrawlConfig setRequestQueueCapacity(int n) { this.requestQueueCapacity = n; return this; }
    public CrawlConfig setPageQueueCapacity(int n) { this.pageQueueCapacity = n; return this; }
    public CrawlConfig setStatusQueueCapacity(int n) { this.statusQueueCapacity = n; return this; }
    public CrawlConfig setTerminationMode(TerminationMode mode) {
        this.terminationMode = (mode != null ? mode : TerminationMode.WORK_COUNTER);
        return this;
    }
    public CrawlConfig setDebounce(Duration debounce) { this.debounce = debounce; return this; }
    public CrawlConfig setPollInterval(Duration pollInterval) { this.pollInterval = pollInterval; return this; }
    public CrawlConfig setMonitorInterval(Duration monitorInterval) { this.monitorInterval = monitorInterval; return this; }
    public CrawlConfig setMaxLinksPerPage(int n) { this.maxLinksPerPage = Math.max(0, n); return this; }
    public CrawlConfig setHttp(HttpCfg http) { this.http = (http != null ? http : new HttpCfg()); return this; }

    // ---------- validate ----------
    public void validate() {
        if (fetchWorkers < 1) throw new IllegalArgumentException("fetchWorkers must be >= 1");
        if (indexWorkers < 1) throw new IllegalArgumentException("indexWorkers must be >= 1");
        if (pageQueueCapacity < 1) throw new IllegalArgumentException("pageQueueCapacity must be >= 1");
        if (statusQueueCapacity > 0 && statusQueueCapacity < getTotalWorkers())
            throw new IllegalArgumentException("statusQueueCapacity must be >= total workers (" + getTotalWorkers() + ")");
        requirePositive(debounce, "debounce");
        requirePositive(pollInterval, "pollInterval");
        requirePositive(monitorInterval, "monitorInterval");
        Objects.requireNonNull(terminationMode, "terminationMode");

        Objects.requireNonNull(http, "http");
        requirePositive(http.getTimeout(), "http.timeout");
        requirePositive(http.getConnectTimeout(), "http.connectTimeout");
    }

    private static void requirePositive(Duration d, String name) {
        if (d == null || d.isNegative() || d.isZero())
            throw new IllegalArgumentException(name + " must be > 0");
    }

    // ---------- helpers ----------
    public static CrawlConfig defaults() { return new CrawlConfig(); }

    /** 테스트 편의: 워커 수 한 번에 */
    public CrawlConfig setWorkers(int fetch, int index) {
        this.fetchWorkers = fetch;
        this.indexWorkers = index;
        return this;
    }
}
