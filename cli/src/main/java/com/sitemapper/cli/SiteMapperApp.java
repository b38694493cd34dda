package com.sitemapper.cli;

import com.sitemapper.cli.logging.LogSetup;
import com.sitemapper.core.crawler.CrawlDispatcher;
import com.sitemapper.core.crawler.InvalidSeedException;
import com.sitemapper.core.model.CrawlConfig;
import com.sitemapper.core.model.Site;
import com.sitemapper.core.service.export.JsonSitemapExporter;
import com.sitemapper.core.service.export.SitemapExporter;
import com.sitemapper.core.service.export.TextSitemapExporter;
import com.sitemapper.core.util.CrawlConfigLoader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Path;
import java.time.Instant;
import java.util.Locale;
import java.util.concurrent.CancellationException;

/**
 * 커맨드라인 진입점.
 *
 * SiteMapperApp [--config crawl.yml] [--mode work_counter|debounce] [--format text|json] [--out DIR] &lt;url&gt;
 *
 * 종료 코드: 0 정상, 1 사용법/설정 오류, 2 잘못된 URL, 3 크롤 중단
 */
public final class SiteMapperApp {

    private static final Logger LOG = LoggerFactory.getLogger(SiteMapperApp.class);

    static final int EXIT_OK = 0;
    static final int EXIT_USAGE = 1;
    static final int EXIT_MALFORMED_URL = 2;
    static final int EXIT_CANCELLED = 3;

    static final String MALFORMED_URL = "Error! Malformed URL.";

    private SiteMapperApp() {}

    public static void main(String[] args) {
        Options peek = Options.parseQuietly(args);
        if (peek != null && peek.outDir != null) LogSetup.configure(peek.outDir);
        else LogSetup.init(null);

        System.exit(run(args, System.out, System.err));
    }

    /** main 의 본체. 테스트에서 직접 호출 (System.exit 없음) */
    static int run(String[] args, PrintStream out, PrintStream err) {
        Options opt;
        try {
            opt = Options.parse(args);
        } catch (IllegalArgumentException e) {
            err.println(e.getMessage());
            err.println(usage());
            return EXIT_USAGE;
        }
        if (opt.help) {
            out.println(usage());
            return EXIT_OK;
        }

        CrawlConfig cfg;
        try {
            cfg = (opt.configFile != null) ? CrawlConfigLoader.load(opt.configFile) : CrawlConfigLoader.fromSystem();
            if (opt.mode != null) cfg.setTerminationMode(CrawlConfigLoader.parseMode(opt.mode));
            if (opt.seed != null) cfg.setSeed(opt.seed);
            cfg.validate();
        } catch (IOException | IllegalArgumentException e) {
            err.println("Config error: " + e.getMessage());
            return EXIT_USAGE;
        }
        if (cfg.getSeed() == null || cfg.getSeed().isBlank()) {
            err.println(usage());
            return EXIT_USAGE;
        }

        String startedIso = Instant.now().toString();
        CrawlDispatcher dispatcher = new CrawlDispatcher(cfg);
        Site site;
        try {
            site = dispatcher.crawl(cfg.getSeed());
        } catch (InvalidSeedException e) {
            LOG.debug("Rejected seed {}: {}", e.getSeed(), e.getMessage());
            out.println(MALFORMED_URL);
            return EXIT_MALFORMED_URL;
        } catch (CancellationException e) {
            err.println("Crawl cancelled: " + e.getMessage());
            return EXIT_CANCELLED;
        }

        try {
            if (opt.json) {
                out.println(new JsonSitemapExporter().render(site, dispatcher.getStats(), Instant.parse(startedIso)));
            } else {
                out.print(new TextSitemapExporter().render(site));
            }
            if (opt.outDir != null) {
                SitemapExporter exporter = opt.json ? new JsonSitemapExporter() : new TextSitemapExporter();
                Path saved = exporter.export(opt.outDir, site, dispatcher.getStats(), startedIso);
                LOG.info("Sitemap saved: {}", saved.toAbsolutePath());
            }
        } catch (Exception e) {
            LOG.error("Sitemap output failed", e);
            err.println("Output failed: " + e.getMessage());
            return EXIT_USAGE;
        }
        return EXIT_OK;
    }

    static String usage() {
        return "Usage: sitemapper [--config crawl.yml] [--mode work_counter|debounce] "
                + "[--format text|json] [--out DIR] <url>";
    }

    /** 인자 파싱 결과 */
    static final class Options {
        Path configFile;
        String mode;
        boolean json;
        Path outDir;
        String seed;
        boolean help;

        static Options parse(String[] args) {
            Options o = new Options();
            if (args == null) args = new String[0];
            for (int i = 0; i < args.length; i++) {
                String a = args[i];
                switch (a) {
                    case "-h", "--help" -> o.help = true;
                    case "--config" -> o.configFile = Path.of(value(args, ++i, a));
                    case "--mode" -> o.mode = value(args, ++i, a);
                    case "--out" -> o.outDir = Path.of(value(args, ++i, a));
                    case "--format" -> {
                        String f = value(args, ++i, a).toLowerCase(Locale.ROOT);
                        if (!f.equals("text") && !f.equals("json")) {
                            throw new IllegalArgumentException("Unknown format: " + f);
                        }
                        o.json = f.equals("json");
                    }
                    default -> {
                        if (a.startsWith("--")) throw new IllegalArgumentException("Unknown option: " + a);
                        if (o.seed != null) throw new IllegalArgumentException("Only one URL is allowed");
                        o.seed = a;
                    }
                }
            }
            if (!o.help && o.seed == null && o.configFile == null) {
                throw new IllegalArgumentException("Missing URL");
            }
            return o;
        }

        /** 로그 설정용 사전 파싱 (오류는 run() 에서 보고) */
        static Options parseQuietly(String[] args) {
            try {
                return parse(args);
            } catch (IllegalArgumentException e) {
                return null;
            }
        }

        private static String value(String[] args, int i, String opt) {
            if (i >= args.length) throw new IllegalArgumentException("Missing value for " + opt);
            return args[i];
        }
    }
}
