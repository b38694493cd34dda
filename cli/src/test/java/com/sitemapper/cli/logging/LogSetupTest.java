package com.sitemapper.cli.logging;

import org.junit.jupiter.api.Test;

import java.util.logging.Level;
import java.util.logging.LogRecord;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

class LogSetupTest {

    @Test
    void levelOf_fallsBackToInfo() {
        assertEquals(Level.FINE, LogSetup.levelOf("fine"));
        assertEquals(Level.WARNING, LogSetup.levelOf(" WARNING "));
        assertEquals(Level.INFO, LogSetup.levelOf("loud"));
        assertEquals(Level.INFO, LogSetup.levelOf(null));
    }

    @Test
    void parseInt_default() {
        assertEquals(3, LogSetup.parseInt("3", 2));
        assertEquals(2, LogSetup.parseInt("x", 2));
        assertEquals(2, LogSetup.parseInt(null, 2));
    }

    @Test
    void lineFormatter_singleLineWithThreadAndLogger() {
        LogRecord r = new LogRecord(Level.WARNING, "request failed for {0}");
        r.setParameters(new Object[]{"http://example.com/x"});
        r.setLoggerName("com.sitemapper.core.crawler.FetchWorker");

        String line = new LogSetup.LineFormatter().format(r);

        assertThat(line).contains("[WARNING]")
                .contains("com.sitemapper.core.crawler.FetchWorker - request failed for http://example.com/x")
                .endsWith(System.lineSeparator());
    }
}
