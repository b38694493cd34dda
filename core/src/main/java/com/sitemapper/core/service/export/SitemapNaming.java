package com.sitemapper.core.service.export;

import java.net.URI;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Instant;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.Locale;

/** 출력 경로 규칙: {@code <out>/sitemaps/<host>/sitemap-<slug>-<yyyyMMdd-HHmm>.<ext>} */
public final class SitemapNaming {

    public static final DateTimeFormatter TS_FMT =
            DateTimeFormatter.ofPattern("yyyyMMdd-HHmm").withZone(ZoneId.systemDefault());

    private SitemapNaming() {}

    public static NamingContext context(Path baseDir, URI domain, String startedIso) {
        Path out = (baseDir == null ? Paths.get("out") : baseDir);
        return new NamingContext(out, extractHost(domain), makeSlug(domain), parseIsoOrNow(startedIso));
    }

    public static String timestamp(NamingContext ctx) { return TS_FMT.format(ctx.startedAt()); }
    public static Path sitemapsDir(NamingContext ctx) { return ctx.baseDir().resolve("sitemaps").resolve(ctx.host()); }
    public static Path textPath(NamingContext ctx) { return sitemapsDir(ctx).resolve(filePrefix(ctx) + ".txt"); }
    public static Path jsonPath(NamingContext ctx) { return sitemapsDir(ctx).resolve(filePrefix(ctx) + ".json"); }

    public static String filePrefix(NamingContext ctx) {
        return "sitemap-" + ctx.slug() + "-" + timestamp(ctx);
    }

    public record NamingContext(Path baseDir, String host, String slug, Instant startedAt) {}

    // ===== helpers =====
    static Instant parseIsoOrNow(String iso) {
        if (iso == null || iso.isBlank()) return Instant.now();
        try {
            return Instant.parse(iso);
        } catch (DateTimeParseException e) {
            return Instant.now();
        }
    }

    static String extractHost(URI domain) {
        String h = (domain == null) ? null : domain.getHost();
        return (h == null ? "unknown-host" : h.toLowerCase(Locale.ROOT)).replaceAll("[^a-z0-9._-]", "-");
    }

    static String makeSlug(URI domain) {
        if (domain == null) return "no-url";
        String s = domain.toString().toLowerCase(Locale.ROOT).replaceFirst("^https?://", "");
        s = s.replaceAll("[^a-z0-9._/-]", "-").replaceAll("-{2,}", "-");
        if (s.length() > 60) s = s.substring(0, 60);
        s = s.replace('/', '-').replaceAll("^-+|-+$", "");
        return s.isEmpty() ? "no-url" : s;
    }
}
