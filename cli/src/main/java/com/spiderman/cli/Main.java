package com.spiderman.cli;

import com.spiderman.core.model.CrawlConfig;
import com.spiderman.core.model.CrawlResult;
import com.spiderman.core.service.CrawlService;
import com.spiderman.core.service.export.OutputDirs;
import com.spiderman.core.util.LoggingConfigurator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.PrintStream;
import java.time.Instant;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.logging.Level;

/**
 * spiderman 명령행 진입점.
 * 종료 코드: 0 완료(취소 포함), 1 실행 중 오류, 2 사용법/설정 오류.
 */
public final class Main {

    static final int EXIT_OK = 0;
    static final int EXIT_FAILURE = 1;
    static final int EXIT_USAGE = 2;

    private Main() {}

    public static void main(String[] args) {
        System.exit(run(args, System.out, System.err));
    }

    static int run(String[] args, PrintStream out, PrintStream err) {
        CliOptions opts;
        CrawlConfig config;
        try {
            opts = CliOptions.parse(args);
            if (opts.isHelp()) {
                out.print(CliOptions.USAGE);
                return EXIT_OK;
            }
            config = opts.toConfig(Instant.now());
        } catch (UsageException e) {
            err.println("spiderman: " + e.getMessage());
            err.println("Try 'spiderman --help' for more information.");
            return EXIT_USAGE;
        }

        Level level = switch (opts.getVerbosity()) {
            case 1 -> Level.FINE;
            case -1 -> Level.WARNING;
            default -> null; // -Dsm.log.level 또는 INFO
        };
        LoggingConfigurator.init(config.getOutputDir().resolve("logs"), level);
        Logger log = LoggerFactory.getLogger(Main.class);

        if (opts.isClear()) {
            try {
                int n = OutputDirs.clear(config.getOutputDir());
                log.info("Cleared {} file(s) in {}", n, config.getOutputDir());
            } catch (IOException e) {
                err.println("spiderman: cannot clear " + config.getOutputDir() + ": " + e.getMessage());
                return EXIT_FAILURE;
            }
        }

        // Ctrl-C: 다음 반복에서 멈추고 부분 결과/요약까지 남긴 뒤 종료
        AtomicBoolean cancel = new AtomicBoolean(false);
        CountDownLatch finished = new CountDownLatch(1);
        Thread hook = new Thread(() -> {
            cancel.set(true);
            try {
                finished.await(30, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }, "shutdown-hook");
        Runtime.getRuntime().addShutdownHook(hook);

        try {
            CrawlResult result = new CrawlService(config).run(null, cancel);
            printSummary(out, config, result);
            return EXIT_OK;
        } catch (RuntimeException e) {
            log.error("Crawl aborted: {}", e.toString(), e);
            err.println("spiderman: crawl aborted: " + e.getMessage());
            return EXIT_FAILURE;
        } finally {
            finished.countDown();
            removeHook(hook);
        }
    }

    private static void removeHook(Thread hook) {
        try {
            Runtime.getRuntime().removeShutdownHook(hook);
        } catch (IllegalStateException e) {
            // JVM 종료 중이면 훅 제거 불가, 훅이 그대로 끝난다
            LoggerFactory.getLogger(Main.class).debug("Shutdown in progress: {}", e.getMessage());
        }
    }

    static void printSummary(PrintStream out, CrawlConfig config, CrawlResult r) {
        var s = r.getStats();
        out.println();
        out.println(r.isCancelled() ? "Crawl cancelled." : "Crawl complete.");
        out.printf("  Pages crawled:   %d%n", s.pagesCrawled);
        out.printf("  Pages failed:    %d%n", s.pagesFailed);
        out.printf("  URLs discovered: %d%n", r.getUrlsDiscovered());
        out.printf("  Links found:     %d (%d new)%n", s.linksFound, s.linksAdmitted);
        if (s.exportFailures > 0) out.printf("  Export failures: %d%n", s.exportFailures);
        out.printf("  Output:          %s%n", config.getOutputPath().toAbsolutePath());
    }
}
