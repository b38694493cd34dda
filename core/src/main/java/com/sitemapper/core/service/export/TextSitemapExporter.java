package com.sitemapper.core.service.export;

import com.sitemapper.core.model.CrawlStats;
import com.sitemapper.core.model.Page;
import com.sitemapper.core.model.Site;

import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.Map;

/**
 * 사람이 읽는 텍스트 사이트맵.
 * <pre>
 * http://example.com/:
 *     /a
 *     LINKS
 *         http://example.com/b
 *     ASSETS
 *         N/A (assets may be inlined)
 * </pre>
 * (실제 들여쓰기는 탭)
 */
public class TextSitemapExporter implements SitemapExporter {

    static final String NO_LINKS = "N/A (no external links found)";
    static final String NO_ASSETS = "N/A (assets may be inlined)";

    @Override
    public Path export(Path baseDir, Site site, CrawlStats.Snapshot stats, String startedIso) throws Exception {
        var ctx = SitemapNaming.context(baseDir, site.getDomain(), startedIso);
        Files.createDirectories(SitemapNaming.sitemapsDir(ctx));
        Path outFile = SitemapNaming.textPath(ctx);
        Files.writeString(outFile, render(site), StandardCharsets.UTF_8,
                StandardOpenOption.CREATE, StandardOpenOption.TRUNCATE_EXISTING);
        return outFile;
    }

    /** 경로 순 정렬된 텍스트 */
    public String render(Site site) {
        StringBuilder sb = new StringBuilder(256 + site.size() * 128);
        sb.append(site.getDomain()).append(":\n");
        for (Map.Entry<String, Page> e : site.getPages().entrySet()) {
            Page page = e.getValue();
            sb.append('\t').append(e.getKey()).append('\n');

            sb.append("\tLINKS\n");
            if (page.links().isEmpty()) {
                sb.append("\t\t").append(NO_LINKS).append('\n');
            } else {
                for (URI link : page.links()) sb.append("\t\t").append(link).append('\n');
            }

            sb.append("\tASSETS\n");
            if (page.assets().isEmpty()) {
                sb.append("\t\t").append(NO_ASSETS).append('\n');
            } else {
                for (String asset : page.assets()) sb.append("\t\t").append(asset).append('\n');
            }
            sb.append('\n');
        }
        return sb.toString();
    }
}
