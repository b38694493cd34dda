package com.sitemapper.core.service.export;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.sitemapper.core.model.CrawlStats;
import com.sitemapper.core.model.Page;
import com.sitemapper.core.model.Site;

import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Instant;
import java.util.Map;

/**
 * JSON 사이트맵 (v1).
 * { version, domain, startedAt, generatedAt, stats{...}, pages:[{path,url,placeholder,links,assets}] }
 * pages 는 경로 순.
 */
public class JsonSitemapExporter implements SitemapExporter {

    static final String FORMAT_VERSION = "1";

    private final ObjectMapper om = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS); // ISO-8601

    @Override
    public Path export(Path baseDir, Site site, CrawlStats.Snapshot stats, String startedIso) throws Exception {
        var ctx = SitemapNaming.context(baseDir, site.getDomain(), startedIso);
        Files.createDirectories(SitemapNaming.sitemapsDir(ctx));
        Path outFile = SitemapNaming.jsonPath(ctx);
        Files.writeString(outFile, render(site, stats, ctx.startedAt()), StandardCharsets.UTF_8,
                StandardOpenOption.CREATE, StandardOpenOption.TRUNCATE_EXISTING);
        return outFile;
    }

    public String render(Site site, CrawlStats.Snapshot stats, Instant startedAt) throws JsonProcessingException {
        ObjectNode root = om.createObjectNode();
        root.put("version", FORMAT_VERSION);
        root.put("domain", site.getDomain().toString());
        root.set("startedAt", om.valueToTree(startedAt));
        root.set("generatedAt", om.valueToTree(Instant.now()));
        root.set("stats", om.valueToTree(stats != null ? stats : CrawlStats.Snapshot.EMPTY));

        ArrayNode pages = root.putArray("pages");
        for (Map.Entry<String, Page> e : site.getPages().entrySet()) {
            Page p = e.getValue();
            ObjectNode n = pages.addObject();
            n.put("path", e.getKey());
            n.put("url", p.url().toString());
            n.put("placeholder", p.placeholder());
            ArrayNode links = n.putArray("links");
            for (URI l : p.links()) links.add(l.toString());
            ArrayNode assets = n.putArray("assets");
            for (String a : p.assets()) assets.add(a);
        }
        return om.writerWithDefaultPrettyPrinter().writeValueAsString(root);
    }
}
