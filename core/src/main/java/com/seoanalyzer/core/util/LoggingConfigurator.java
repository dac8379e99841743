package com.seoanalyzer.core.util;

import com.seoanalyzer.core.observability.TraceContext;

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
 * java.util.logging 전역 설정 (SLF4J는 slf4j-jdk14로 여기 합류).
 * 콘솔 + 사이즈 롤링 파일(seo-analyzer-%g.log). 라인마다 현재 traceId 를 붙인다.
 * System props:
 *  -Dseo.log.level=FINE|INFO|WARNING|SEVERE (설정 파일 값보다 우선)
 *  -Dseo.log.console=true|false (기본 true)
 */
public final class LoggingConfigurator {
    private LoggingConfigurator() {}

    private static final Formatter LINE_FORMATTER = new LineFormatter();

    public static synchronized void init(Path logDir, Level rootLevel, int maxBytes, int fileCount) {
        Level level = levelOf(System.getProperty("seo.log.level"), rootLevel == null ? Level.INFO : rootLevel);
        boolean toConsole = !"false".equalsIgnoreCase(System.getProperty("seo.log.console", "true"));

        Logger root = LogManager.getLogManager().getLogger("");
        for (Handler h : root.getHandlers()) root.removeHandler(h);

        if (toConsole) {
            ConsoleHandler console = new ConsoleHandler();
            console.setLevel(level);
            console.setFormatter(LINE_FORMATTER);
            root.addHandler(console);
        }

        try {
            Files.createDirectories(logDir);
            String pattern = logDir.resolve("seo-analyzer-%g.log").toString();
            FileHandler file = new FileHandler(pattern, Math.max(1, maxBytes), Math.max(1, fileCount), true);
            file.setLevel(level);
            file.setFormatter(LINE_FORMATTER); // 같은 포맷
            root.addHandler(file);
        } catch (IOException e) {
            // 파일 핸들러 없이 콘솔만으로 진행
            Logger.getAnonymousLogger().log(Level.WARNING, "Failed to init file handler: " + e.getMessage(), e);
        }

        root.setLevel(level);
    }

    /** 문자열을 Level로 (실패/공백이면 def) */
    public static Level levelOf(String name, Level def) {
        if (name == null || name.isBlank()) return def;
        String n = name.trim().toUpperCase(Locale.ROOT);
        // DEBUG/WARN/ERROR 별칭도 허용
        switch (n) {
            case "DEBUG": return Level.FINE;
            case "WARN":  return Level.WARNING;
            case "ERROR": return Level.SEVERE;
            default:
                try { return Level.parse(n); }
                catch (IllegalArgumentException e) { return def; }
        }
    }

    /** 한 줄 포맷 + 스레드명 + traceId + 예외 스택 */
    private static final class LineFormatter extends Formatter {
        @Override public String format(LogRecord r) {
            String msg = formatMessage(r);
            String base = String.format(Locale.ROOT,
                    "%1$tF %1$tT.%1$tL [%2$s] (%3$s) <%4$s> %5$s - %6$s%n",
                    r.getMillis(), r.getLevel().getName(),
                    Thread.currentThread().getName(),
                    TraceContext.currentTraceId().orElse("-"),
                    shortName(r.getLoggerName()), msg);

            Throwable t = r.getThrown();
            if (t == null) return base;

            StringWriter sw = new StringWriter(256);
            t.printStackTrace(new PrintWriter(sw));
            return base + sw + System.lineSeparator();
        }

        private static String shortName(String logger) {
            if (logger == null) return "";
            int dot = logger.lastIndexOf('.');
            return dot < 0 ? logger : logger.substring(dot + 1);
        }
    }
}
