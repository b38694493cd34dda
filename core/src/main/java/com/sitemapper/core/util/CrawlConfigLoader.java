package com.sitemapper.core.util;

import com.sitemapper.core.model.CrawlConfig;
import com.sitemapper.core.model.TerminationMode;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.SafeConstructor;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.function.Consumer;
import java.util.function.IntConsumer;

/**
 * crawl.yml → CrawlConfig. 적용 순서: 기본값 → YAML → 시스템 프로퍼티(-Dsm.*)
 *
 * 예상 YAML 키:
 * seed: "example.com"
 * defaultScheme: http
 * workers:
 *   fetch: 10
 *   index: 10
 * queues:
 *   requestCapacity: 0      # 0 = 무제한
 *   pageCapacity: 400
 *   statusCapacity: 0       # 0 = 8 × 워커 수
 * termination:
 *   mode: work_counter      # work_counter | debounce
 *   debounceMs: 2000
 *   pollIntervalMs: 50
 *   monitorIntervalMs: 10
 * http:
 *   timeoutMs: 10000
 *   connectTimeoutMs: 5000
 *   followRedirects: true
 *   userAgent: "SiteMapper/0.1"
 * maxLinksPerPage: 0
 *
 * 시스템 프로퍼티: sm.seed, sm.workers.fetch, sm.workers.index, sm.termination.mode,
 *                  sm.termination.debounceMs, sm.maxLinksPerPage, sm.http.timeoutMs
 */
public final class CrawlConfigLoader {

    private CrawlConfigLoader() {}

    /** YAML 없이: 기본값 + 시스템 프로퍼티 */
    public static CrawlConfig fromSystem() {
        CrawlConfig cfg = CrawlConfig.defaults();
        applySystemOverrides(cfg);
        cfg.validate();
        return cfg;
    }

    public static CrawlConfig loadDefault() throws IOException {
        return load(Path.of("crawl.yml"));
    }

    public static CrawlConfig load(Path yamlPath) throws IOException {
        Objects.requireNonNull(yamlPath, "yamlPath");
        if (!Files.exists(yamlPath)) {
            throw new IOException("crawl.yml not found at: " + yamlPath.toAbsolutePath());
        }
        try (InputStream in = Files.newInputStream(yamlPath)) {
            Object root = yaml().load(in);
            return build(root);
        }
    }

    /** 문자열 YAML (테스트/임베드용) */
    public static CrawlConfig parse(String yamlText) {
        return build(yaml().load(yamlText == null ? "" : yamlText));
    }

    private static Yaml yaml() {
        return new Yaml(new SafeConstructor(new LoaderOptions()));
    }

    private static CrawlConfig build(Object root) {
        CrawlConfig cfg = CrawlConfig.defaults();

        if (root instanceof Map<?, ?> map) {
            // 1) 평면 키
            setString(map, "seed", cfg::setSeed);
            setString(map, "defaultScheme", cfg::setDefaultScheme);
            setInt(map, "maxLinksPerPage", cfg::setMaxLinksPerPage);

            // 2) workers.*
            Map<?, ?> workers = getMap(map, "workers");
            if (workers != null) {
                setInt(workers, "fetch", cfg::setFetchWorkers);
                setInt(workers, "index", cfg::setIndexWorkers);
            }

            // 3) queues.*
            Map<?, ?> queues = getMap(map, "queues");
            if (queues != null) {
                setInt(queues, "requestCapacity", cfg::setRequestQueueCapacity);
                setInt(queues, "pageCapacity", cfg::setPageQueueCapacity);
                setInt(queues, "statusCapacity", cfg::setStatusQueueCapacity);
            }

            // 4) termination.*
            Map<?, ?> term = getMap(map, "termination");
            if (term != null) {
                setMode(term.get("mode"), cfg);
                setDurationMs(term, "debounceMs", cfg::setDebounce);
                setDurationMs(term, "pollIntervalMs", cfg::setPollInterval);
                setDurationMs(term, "monitorIntervalMs", cfg::setMonitorInterval);
            }

            // 5) http.*
            Map<?, ?> http = getMap(map, "http");
            if (http != null) {
                var h = cfg.getHttp();
                setDurationMs(http, "timeoutMs", h::setTimeout);
                setDurationMs(http, "connectTimeoutMs", h::setConnectTimeout);
                setBoolean(http, "followRedirects", h::setFollowRedirects);
                setString(http, "userAgent", h::setUserAgent);
            }
        }
        // 비어있거나 단순 스칼라면 defaults 유지

        applySystemOverrides(cfg);
        cfg.validate();
        return cfg;
    }

    /** -Dsm.* 가 YAML 값을 덮어쓴다 */
    static void applySystemOverrides(CrawlConfig cfg) {
        String seed = System.getProperty("sm.seed");
        if (seed != null && !seed.isBlank()) cfg.setSeed(seed.trim());

        int fetch = sysInt("sm.workers.fetch", -1);
        if (fetch > 0) cfg.setFetchWorkers(fetch);
        int index = sysInt("sm.workers.index", -1);
        if (index > 0) cfg.setIndexWorkers(index);

        setMode(System.getProperty("sm.termination.mode"), cfg);

        int debounceMs = sysInt("sm.termination.debounceMs", -1);
        if (debounceMs > 0) cfg.setDebounce(Duration.ofMillis(debounceMs));
        int cap = sysInt("sm.maxLinksPerPage", -1);
        if (cap >= 0) cfg.setMaxLinksPerPage(cap);
        int timeoutMs = sysInt("sm.http.timeoutMs", -1);
        if (timeoutMs > 0) cfg.getHttp().setTimeout(Duration.ofMillis(timeoutMs));
    }

    /** "work_counter", "WORK-COUNTER", "debounce" 모두 허용. 모르는 값이면 IAE */
    public static TerminationMode parseMode(String raw) {
        if (raw == null || raw.isBlank()) throw new IllegalArgumentException("termination mode is empty");
        String s = raw.trim().replace('-', '_').toUpperCase(Locale.ROOT);
        try {
            return TerminationMode.valueOf(s);
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown termination mode: " + raw, e);
        }
    }

    // ------------ helpers ------------
    private static void setMode(Object v, CrawlConfig cfg) {
        if (v == null || String.valueOf(v).isBlank()) return;
        cfg.setTerminationMode(parseMode(String.valueOf(v)));
    }

    private static Map<?, ?> getMap(Map<?, ?> map, String key) {
        Object v = map.get(key);
        return (v instanceof Map<?, ?> m) ? m : null;
    }

    private static void setString(Map<?, ?> map, String key, Consumer<String> setter) {
        Object v = map.get(key);
        if (v != null) setter.accept(String.valueOf(v));
    }

    private static void setBoolean(Map<?, ?> map, String key, Consumer<Boolean> setter) {
        Object v = map.get(key);
        if (v instanceof Boolean b) setter.accept(b);
        else if (v != null) setter.accept(Boolean.parseBoolean(String.valueOf(v)));
    }

    private static void setInt(Map<?, ?> map, String key, IntConsumer setter) {
        Object v = map.get(key);
        if (v instanceof Number n) setter.accept(n.intValue());
        else if (v != null) setter.accept(Integer.parseInt(String.valueOf(v).trim()));
    }

    /** 0 이하도 그대로 넘겨 validate() 에서 걸러지게 한다 */
    private static void setDurationMs(Map<?, ?> map, String key, Consumer<Duration> setter) {
        Object v = map.get(key);
        if (v == null) return;
        long ms = (v instanceof Number n) ? n.longValue() : Long.parseLong(String.valueOf(v).trim());
        setter.accept(Duration.ofMillis(ms));
    }

    private static int sysInt(String key, int def) {
        String v = System.getProperty(key);
        if (v == null || v.isBlank()) return def;
        try {
            return Integer.parseInt(v.trim());
        } catch (NumberFormatException e) {
            return def;
        }
    }
}
