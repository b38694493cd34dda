package com.sitemapper.core.service.export;

import com.sitemapper.core.model.CrawlStats;
import com.sitemapper.core.model.Page;
import com.sitemapper.core.model.Site;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

class TextSitemapExporterTest {

    static Site sampleSite() {
        URI d = URI.create("http://example.com/");
        Map<String, Page> pages = new LinkedHashMap<>();
        pages.put("/", Page.of(d,
                List.of(URI.create("http://example.com/a")),
                List.of("http://example.com/logo.png")));
        pages.put("/a", Page.of(URI.create("http://example.com/a"), List.of(), List.of()));
        return new Site(d, pages);
    }

    @Test
    void render_matchesLayout() {
        String text = new TextSitemapExporter().render(sampleSite());

        String expected = "http://example.com/:\n"
                + "\t/\n"
                + "\tLINKS\n"
                + "\t\thttp://example.com/a\n"
                + "\tASSETS\n"
                + "\t\thttp://example.com/logo.png\n"
                + "\n"
                + "\t/a\n"
                + "\tLINKS\n"
                + "\t\tN/A (no external links found)\n"
                + "\tASSETS\n"
                + "\t\tN/A (assets may be inlined)\n"
                + "\n";
        assertEquals(expected, text);
    }

    @Test
    void export_writesUnderSitemapsHostDir(@TempDir Path tmp) throws Exception {
        Path out = new TextSitemapExporter()
                .export(tmp, sampleSite(), CrawlStats.Snapshot.EMPTY, "2024-05-01T10:15:30Z");

        assertTrue(Files.exists(out));
        assertEquals(tmp.resolve("sitemaps").resolve("example.com"), out.getParent());
        assertThat(out.getFileName().toString()).startsWith("sitemap-example.com-").endsWith(".txt");
        assertThat(Files.readString(out, StandardCharsets.UTF_8)).startsWith("http://example.com/:\n");
    }
}
