package com.urlsentry.app.logging;

import com.urlsentry.core.util.StructuredLog;

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
 * java.util.logging 전역 설정.
 * 콘솔(stderr)은 사람용 로그만, 파일은 JSON 구조화 이벤트까지 전부 남긴다.
 * System props:
 *  -Dus.log.dir=logs        지정 시 dir/urlsentry-%g.log 로 사이즈 롤링
 *  -Dus.log.level=FINE|INFO|WARNING|SEVERE   (CLI 플래그보다 우선)
 *  -Dus.log.sizeMb=2
 *  -Dus.log.files=5
 */
public final class LogSetup {
    private LogSetup() {}

    private static volatile boolean initialized = false; // 재초기화 방지
    private static final Formatter LINE_FORMATTER = new LineFormatter();

    public static synchronized void init(Level requested) {
        if (initialized) {
            setLevel(requested);
            return;
        }
        initialized = true;

        Level level = resolveLevel(requested);
        LogManager.getLogManager().reset();
        Logger root = Logger.getLogger("");

        // 콘솔: stderr, 구조화 이벤트 제외(stdout은 보고서 전용)
        ConsoleHandler console = new ConsoleHandler();
        console.setLevel(level);
        console.setFormatter(LINE_FORMATTER);
        console.setFilter(r -> !isStructured(r));
        root.addHandler(console);

        String dir = System.getProperty("us.log.dir");
        if (dir != null && !dir.isBlank()) {
            addFileHandler(root, Path.of(dir.trim()), level);
        }
        root.setLevel(level);
    }

    /** 런타임에 로그 레벨 변경 (콘솔/파일 모두) */
    public static void setLevel(Level level) {
        Level l = resolveLevel(level);
        Logger root = Logger.getLogger("");
        root.setLevel(l);
        for (Handler h : root.getHandlers()) h.setLevel(l);
    }

    /** 문자열을 Level로(실패 시 INFO) */
    public static Level levelOf(String name) {
        try { return Level.parse(String.valueOf(name).trim().toUpperCase(Locale.ROOT)); }
        catch (IllegalArgumentException e) { return Level.INFO; }
    }

    static boolean isStructured(LogRecord r) {
        String name = r.getLoggerName();
        return name != null && name.startsWith(StructuredLog.LOGGER_PREFIX);
    }

    private static void addFileHandler(Logger root, Path logDir, Level level) {
        int sizeMb  = parseInt(System.getProperty("us.log.sizeMb"), 2);
        int fileCnt = parseInt(System.getProperty("us.log.files"), 5);
        try {
            Files.createDirectories(logDir);
            String pattern = logDir.resolve("urlsentry-%g.log").toString();
            FileHandler file = new FileHandler(pattern, sizeMb * 1024 * 1024, fileCnt, true);
            file.setLevel(level);
            file.setFormatter(LINE_FORMATTER);
            root.addHandler(file);
        } catch (IOException e) {
            // 파일 로그 없이 콘솔만으로 진행
            Logger.getLogger(LogSetup.class.getName()).log(Level.WARNING,
                    "File logging disabled: " + e.getMessage(), e);
        }
    }

    private static Level resolveLevel(Level requested) {
        String sys = System.getProperty("us.log.level");
        if (sys != null && !sys.isBlank()) return levelOf(sys);
        return (requested == null) ? Level.INFO : requested;
    }

    private static int parseInt(String s, int def) {
        try { return (s == null || s.isBlank()) ? def : Integer.parseInt(s.trim()); }
        catch (NumberFormatException e) { return def; }
    }

    /** 한 줄 포맷 + 스레드명 + 예외 스택 */
    private static final class LineFormatter extends Formatter {
        @Override public String format(LogRecord r) {
            String msg = formatMessage(r);
            if (isStructured(r)) return msg + System.lineSeparator();
            String base = String.format(Locale.ROOT,
                    "%1$tF %1$tT.%1$tL [%2$s] (%3$s) %4$s - %5$s%n",
                    r.getMillis(), r.getLevel().getName(),
                    Thread.currentThread().getName(),
                    shortName(r.getLoggerName()), msg);

            Throwable t = r.getThrown();
            if (t == null) return base;

            StringWriter sw = new StringWriter(256);
            t.printStackTrace(new PrintWriter(sw));
            return base + sw + System.lineSeparator();
        }

        private static String shortName(String name) {
            if (name == null) return "";
            int i = name.lastIndexOf('.');
            return (i < 0) ? name : name.substring(i + 1);
        }
    }
}
