package com.sitemapper.cli.logging;

import java.io.IOException;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;
import java.util.logging.ConsoleHandler;
import java.util.logging.FileHandler;
import java.util.logging.Formatter;
import java.util.logging.Handler;
import java.util.logging.Level;
import java.util.logging.LogManager;
import java.util.logging.LogRecord;
import java.util.logging.Logger;

/**
 * java.util.logging 전역 설정 (SLF4J는 slf4j-jdk14 로 여기에 붙는다).
 * 콘솔(stderr) + 선택적 사이즈 롤링 파일(기본 2MB x 5). stdout 은 사이트맵 출력 전용.
 *
 * System props:
 *  -Dsm.log.level=FINE|INFO|WARNING|SEVERE (기본 INFO)
 *  -Dsm.log.sizeMb=2
 *  -Dsm.log.files=5
 *  -Dsm.log.console=true|false (기본 true)
 */
public final class LogSetup {
    private LogSetup() {}

    private static volatile boolean initialized = false; // 재초기화 방지
    private static final Formatter LINE_FORMATTER = new LineFormatter();

    /** outRoot/logs/sitemapper-%g.log 로 저장 */
    public static synchronized void configure(Path outRoot) {
        init(outRoot == null ? null : outRoot.resolve("logs"));
    }

    /** logDir 가 null 이면 콘솔만 */
    public static synchronized void init(Path logDir) {
        if (initialized) return;
        initialized = true;

        Level level = levelOf(System.getProperty("sm.log.level", "INFO"));
        int sizeMb = parseInt(System.getProperty("sm.log.sizeMb"), 2);
        int fileCnt = parseInt(System.getProperty("sm.log.files"), 5);
        boolean toConsole = !"false".equalsIgnoreCase(System.getProperty("sm.log.console", "true"));

        // 루트 로거 초기화
        LogManager.getLogManager().reset();
        Logger root = Logger.getLogger("");
        root.setLevel(level);

        if (toConsole) {
            ConsoleHandler console = new ConsoleHandler();
            console.setLevel(level);
            console.setFormatter(LINE_FORMATTER);
            root.addHandler(console);
        }

        if (logDir != null) {
            try {
                Files.createDirectories(logDir);
                String pattern = logDir.resolve("sitemapper-%g.log").toString();
                FileHandler file = new FileHandler(pattern, sizeMb * 1024 * 1024, Math.max(1, fileCnt), true);
                file.setLevel(level);
                file.setFormatter(LINE_FORMATTER);
                root.addHandler(file);
            } catch (IOException e) {
                // 파일 로그 실패 시 콘솔만으로 진행
                Logger.getAnonymousLogger().log(Level.WARNING, "Log file setup failed: " + e.getMessage(), e);
            }
        }

        Logger.getLogger(LogSetup.class.getName()).log(Level.FINE,
                () -> "Log initialized. dir=" + (logDir == null ? "-" : logDir.toAbsolutePath()) + ", level=" + level.getName());
    }

    /** 런타임에 로그 레벨 변경 (루트 + 모든 핸들러) */
    public static void setLevel(Level level) {
        Level lv = (level == null) ? Level.INFO : level;
        Logger root = Logger.getLogger("");
        root.setLevel(lv);
        for (Handler h : root.getHandlers()) {
            h.setLevel(lv);
        }
    }

    /** 문자열을 Level로(실패 시 INFO) */
    public static Level levelOf(String name) {
        try { return Level.parse(String.valueOf(name).trim().toUpperCase(Locale.ROOT)); }
        catch (IllegalArgumentException e) { return Level.INFO; }
    }

    static int parseInt(String s, int def) {
        try { return (s == null || s.isBlank()) ? def : Integer.parseInt(s.trim()); }
        catch (NumberFormatException ignored) { return def; }
    }

    /** 한 줄 포맷 + 스레드명 + 예외 스택 */
    static final class LineFormatter extends Formatter {
        @Override public String format(LogRecord r) {
            String msg = formatMessage(r);
            String base = String.format(Locale.ROOT,
                    "%1$tF %1$tT.%1$tL [%2$s] (%3$s) %4$s - %5$s%n",
                    r.getMillis(), r.getLevel().getName(),
                    Thread.currentThread().getName(),
                    r.getLoggerName(), msg);

            Throwable t = r.getThrown();
            if (t == null) return base;

            StringWriter sw = new StringWriter(256);
            t.printStackTrace(new PrintWriter(sw));
            return base + sw + System.lineSeparator();
        }
    }
}
