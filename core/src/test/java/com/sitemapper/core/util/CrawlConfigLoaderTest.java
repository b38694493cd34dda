package com.sitemapper.core.util;

import com.sitemapper.core.model.CrawlConfig;
import com.sitemapper.core.model.TerminationMode;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.*;

@DisplayName("CrawlConfigLoader — crawl.yml + -Dsm.* 오버라이드")
class CrawlConfigLoaderTest {

    @TempDir
    Path tmp;

    @AfterEach
    void clearProps() {
        System.clearProperty("sm.workers.fetch");
        System.clearProperty("sm.termination.mode");
        System.clearProperty("sm.seed");
    }

    @Test
    void loadsAllSections() throws IOException {
        Path yml = tmp.resolve("crawl.yml");
        Files.writeString(yml, """
                seed: "example.com"
                defaultScheme: https
                workers:
                  fetch: 3
                  index: 2
                queues:
                  requestCapacity: 100
                  pageCapacity: 50
                  statusCapacity: 40
                termination:
                  mode: debounce
                  debounceMs: 500
                  pollIntervalMs: 20
                  monitorIntervalMs: 5
                http:
                  timeoutMs: 3000
                  connectTimeoutMs: 1000
                  followRedirects: false
                  userAgent: "TestAgent/1.0"
                maxLinksPerPage: 25
                """);

        CrawlConfig cfg = CrawlConfigLoader.load(yml);

        assertEquals("example.com", cfg.getSeed());
        assertEquals("https", cfg.getDefaultScheme());
        assertEquals(3, cfg.getFetchWorkers());
        assertEquals(2, cfg.getIndexWorkers());
        assertEquals(100, cfg.getRequestQueueCapacity());
        assertEquals(50, cfg.getPageQueueCapacity());
        assertEquals(40, cfg.getStatusQueueCapacity());
        assertEquals(TerminationMode.DEBOUNCE, cfg.getTerminationMode());
        assertEquals(Duration.ofMillis(500), cfg.getDebounce());
        assertEquals(Duration.ofMillis(20), cfg.getPollInterval());
        assertEquals(Duration.ofMillis(5), cfg.getMonitorInterval());
        assertEquals(Duration.ofSeconds(3), cfg.getHttp().getTimeout());
        assertEquals(Duration.ofSeconds(1), cfg.getHttp().getConnectTimeout());
        assertFalse(cfg.getHttp().isFollowRedirects());
        assertEquals("TestAgent/1.0", cfg.getHttp().getUserAgent());
        assertEquals(25, cfg.getMaxLinksPerPage());
    }

    @Test
    void emptyYaml_keepsDefaults() {
        CrawlConfig cfg = CrawlConfigLoader.parse("");
        assertEquals(10, cfg.getFetchWorkers());
        assertEquals(10, cfg.getIndexWorkers());
        assertEquals(400, cfg.getPageQueueCapacity());
        assertEquals(160, cfg.getStatusQueueCapacity());
        assertEquals(TerminationMode.WORK_COUNTER, cfg.getTerminationMode());
        assertEquals(Duration.ofSeconds(2), cfg.getDebounce());
    }

    @Test
    void systemPropertiesOverrideYaml() {
        System.setProperty("sm.workers.fetch", "7");
        System.setProperty("sm.termination.mode", "DEBOUNCE");
        System.setProperty("sm.seed", "override.example.com");

        CrawlConfig cfg = CrawlConfigLoader.parse("seed: a.example.com\nworkers: { fetch: 2 }\n");

        assertEquals(7, cfg.getFetchWorkers());
        assertEquals(TerminationMode.DEBOUNCE, cfg.getTerminationMode());
        assertEquals("override.example.com", cfg.getSeed());
    }

    @Test
    void invalidValues_rejectedByValidate() {
        assertThatThrownBy(() -> CrawlConfigLoader.parse("workers: { fetch: 0 }"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("fetchWorkers");
        assertThatThrownBy(() -> CrawlConfigLoader.parse("termination: { debounceMs: 0 }"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("debounce");
        assertThatThrownBy(() -> CrawlConfigLoader.parse("termination: { mode: eventually }"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Unknown termination mode");
    }

    @Test
    void parseMode_acceptsLooseSpellings() {
        assertEquals(TerminationMode.WORK_COUNTER, CrawlConfigLoader.parseMode("work-counter"));
        assertEquals(TerminationMode.WORK_COUNTER, CrawlConfigLoader.parseMode(" work_counter "));
        assertEquals(TerminationMode.DEBOUNCE, CrawlConfigLoader.parseMode("Debounce"));
    }

    @Test
    void missingFile_throwsIOException() {
        Path missing = tmp.resolve("nope.yml");
        assertThatThrownBy(() -> CrawlConfigLoader.load(missing))
                .isInstanceOf(IOException.class)
                .hasMessageContaining("crawl.yml not found");
        assertThat(Files.exists(missing)).isFalse();
    }
}
