package com.sitemapper.cli;

import com.sun.net.httpserver.HttpServer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.io.PrintStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

@DisplayName("SiteMapperApp — 인자/종료 코드/출력")
@Timeout(30)
class SiteMapperAppTest {

    private final ByteArrayOutputStream outBuf = new ByteArrayOutputStream();
    private final ByteArrayOutputStream errBuf = new ByteArrayOutputStream();
    private final PrintStream out = new PrintStream(outBuf, true, StandardCharsets.UTF_8);
    private final PrintStream err = new PrintStream(errBuf, true, StandardCharsets.UTF_8);

    private HttpServer server;
    private String base;

    @BeforeEach
    void start() throws IOException {
        Map<String, String> pages = Map.of(
                "/", "<html><a href='/a'>a</a><img src='/logo.png'></html>",
                "/a", "<html><a href='/'>home</a></html>");
        server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        server.createContext("/", ex -> {
            String body = pages.get(ex.getRequestURI().getPath());
            byte[] bytes = (body == null ? "" : body).getBytes(StandardCharsets.UTF_8);
            ex.getResponseHeaders().add("Content-Type", "text/html");
            ex.sendResponseHeaders(body == null ? 404 : 200, bytes.length == 0 ? -1 : bytes.length);
            try (OutputStream os = ex.getResponseBody()) {
                os.write(bytes);
            }
        });
        server.start();
        base = "http://127.0.0.1:" + server.getAddress().getPort() + "/";
    }

    @AfterEach
    void stop() {
        server.stop(0);
    }

    private String stdout() { return outBuf.toString(StandardCharsets.UTF_8); }
    private String stderr() { return errBuf.toString(StandardCharsets.UTF_8); }

    @Test
    void noArgs_printsUsage_exit1() {
        assertEquals(1, SiteMapperApp.run(new String[0], out, err));
        assertThat(stderr()).contains("Usage:");
    }

    @Test
    void unknownOptionOrFormat_exit1() {
        assertEquals(1, SiteMapperApp.run(new String[]{"--bogus", base}, out, err));
        assertEquals(1, SiteMapperApp.run(new String[]{"--format", "xml", base}, out, err));
        assertEquals(1, SiteMapperApp.run(new String[]{"--mode", "sometimes", base}, out, err));
        assertEquals(1, SiteMapperApp.run(new String[]{base, "http://second.example.com"}, out, err));
    }

    @Test
    void help_exit0() {
        assertEquals(0, SiteMapperApp.run(new String[]{"--help"}, out, err));
        assertThat(stdout()).contains("Usage:");
    }

    @Test
    void malformedUrl_exit2() {
        assertEquals(2, SiteMapperApp.run(new String[]{"http://exa mple.com/"}, out, err));
        assertEquals("Error! Malformed URL.", stdout().trim());
    }

    @Test
    void textOutput_listsPagesLinksAndAssets() {
        int code = SiteMapperApp.run(new String[]{base}, out, err);

        assertEquals(0, code, stderr());
        String text = stdout();
        assertThat(text).startsWith(base + ":\n");
        assertThat(text).contains("\t/\n\tLINKS\n\t\t" + base + "a\n");
        assertThat(text).contains("\tASSETS\n\t\t" + base + "logo.png\n");
        assertThat(text).contains("\t/a\n");
        assertThat(text).contains("N/A (assets may be inlined)");
    }

    @Test
    void jsonOutput_withDebounceMode_andFileExport(@TempDir Path tmp) throws IOException {
        int code = SiteMapperApp.run(new String[]{
                "--mode", "debounce", "--format", "json", "--out", tmp.toString(), base}, out, err);

        assertEquals(0, code, stderr());
        assertThat(stdout()).contains("\"domain\" : \"" + base + "\"").contains("\"path\" : \"/a\"");

        Path dir = tmp.resolve("sitemaps").resolve("127.0.0.1");
        try (Stream<Path> files = Files.list(dir)) {
            assertThat(files.map(p -> p.getFileName().toString()))
                    .singleElement().satisfies(n -> assertThat(n).startsWith("sitemap-").endsWith(".json"));
        }
    }

    @Test
    void configFileSuppliesSeed(@TempDir Path tmp) throws IOException {
        Path yml = tmp.resolve("crawl.yml");
        Files.writeString(yml, "seed: \"" + base + "\"\nworkers: { fetch: 2, index: 1 }\n");

        assertEquals(0, SiteMapperApp.run(new String[]{"--config", yml.toString()}, out, err), stderr());
        assertThat(stdout()).contains("\t/a\n");
    }

    @Test
    void missingConfigFile_exit1(@TempDir Path tmp) {
        assertEquals(1, SiteMapperApp.run(new String[]{"--config", tmp.resolve("none.yml").toString(), base}, out, err));
        assertThat(stderr()).contains("Config error");
    }
}
