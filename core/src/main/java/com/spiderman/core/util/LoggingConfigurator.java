package com.spiderman.core.util;

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
 * java.util.logging 전역 설정 (SLF4J는 slf4j-jdk14로 여기에 붙는다).
 * - 콘솔: 한 줄 포맷 (stderr)
 * - 파일: logDir가 주어지면 logDir/crawl-%g.log 사이즈 롤링 (기본 2MB x 5)
 * System props:
 *  -Dsm.log.level=FINE|INFO|WARNING|SEVERE  (level 인자가 null일 때)
 *  -Dsm.log.sizeMb=2
 *  -Dsm.log.files=5
 */
public final class LoggingConfigurator {
    private LoggingConfigurator() {}

    static final Formatter LINE_FORMATTER = new LineFormatter();

    /**
     * @param logDir 파일 로그 디렉터리 (null이면 콘솔만)
     * @param level  루트 레벨 (null이면 -Dsm.log.level → INFO)
     */
    public static synchronized void init(Path logDir, Level level) {
        Level lvl = (level != null) ? level : levelOf(System.getProperty("sm.log.level", "INFO"));

        LogManager.getLogManager().reset();
        Logger root = Logger.getLogger("");

        ConsoleHandler console = new ConsoleHandler();
        console.setLevel(lvl);
        console.setFormatter(LINE_FORMATTER);
        root.addHandler(console);

        if (logDir != null) {
            int sizeMb  = parseInt(System.getProperty("sm.log.sizeMb"), 2);
            int fileCnt = parseInt(System.getProperty("sm.log.files"), 5);
            try {
                Files.createDirectories(logDir);
                String pattern = logDir.resolve("crawl-%g.log").toString();
                FileHandler file = new FileHandler(pattern, sizeMb * 1024 * 1024, fileCnt, true);
                file.setLevel(lvl);
                file.setFormatter(LINE_FORMATTER);
                root.addHandler(file);
            } catch (IOException e) {
                // 파일 로그 실패 시 콘솔만으로 진행
                Logger.getLogger(LoggingConfigurator.class.getName())
                        .log(Level.WARNING, "File log setup failed: " + e.getMessage(), e);
            }
        }

        root.setLevel(lvl);
    }

    /** 실행 중 레벨 변경 (루트 + 모든 핸들러) */
    public static void setLevel(Level level) {
        Level lvl = (level == null) ? Level.INFO : level;
        Logger root = Logger.getLogger("");
        root.setLevel(lvl);
        for (Handler h : root.getHandlers()) h.setLevel(lvl);
    }

    /** 문자열을 Level로 (실패 시 INFO). "debug"/"warn"/"error" 별칭 허용 */
    public static Level levelOf(String name) {
        if (name == null || name.isBlank()) return Level.INFO;
        String s = name.trim().toUpperCase(Locale.ROOT);
        switch (s) {
            case "DEBUG": return Level.FINE;
            case "TRACE": return Level.FINEST;
            case "WARN":  return Level.WARNING;
            case "ERROR": return Level.SEVERE;
            default:
                try { return Level.parse(s); }
                catch (IllegalArgumentException e) { return Level.INFO; }
        }
    }

    private static int parseInt(String s, int def) {
        try { return (s == null || s.isBlank()) ? def : Integer.parseInt(s.trim()); }
        catch (NumberFormatException e) { return def; }
    }

    /** 한 줄 포맷 + 예외 스택 */
    private static final class LineFormatter extends Formatter {
        @Override public String format(LogRecord r) {
            String base = String.format(Locale.ROOT,
                    "%1$tF %1$tT.%1$tL [%2$s] %3$s - %4$s%n",
                    r.getMillis(), r.getLevel().getName(),
                    shortName(r.getLoggerName()), formatMessage(r));

            Throwable t = r.getThrown();
            if (t == null) return base;

            StringWriter sw = new StringWriter(256);
            t.printStackTrace(new PrintWriter(sw));
            return base + sw + System.lineSeparator();
        }

        private static String shortName(String logger) {
            if (logger == null) return "-";
            int i = logger.lastIndexOf('.');
            return (i < 0) ? logger : logger.substring(i + 1);
        }
    }
}
