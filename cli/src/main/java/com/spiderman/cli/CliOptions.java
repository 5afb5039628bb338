package com.spiderman.cli;

import com.spiderman.core.model.CrawlConfig;
import com.spiderman.core.model.CrawlConfig.LinkExtractorKind;
import com.spiderman.core.model.CrawlConfig.OutputFormat;
import com.spiderman.core.service.export.ExportNaming;
import com.spiderman.core.util.UrlUtils;
import com.spiderman.core.util.YamlConfigLoader;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * 명령행 인자 → CrawlConfig.
 * 우선순위: 기본값 &lt; --config YAML &lt; 명령행 플래그.
 */
public final class CliOptions {

    public static final String USAGE = """
            Usage: spiderman <seed-url> [options]

            Options:
              --max-pages N          Stop after N pages have been admitted (default: unlimited).
              --allow-domain HOST    Only follow links to HOST (repeatable).
              --same-domain          Only follow links to the seed's host.
              --out DIR              Output directory (default: output).
              --file NAME            Output file name (default: crawl.jsonl).
              --auto-name            Name the output file crawl-<host>-<yyyyMMdd-HHmm>.jsonl|json.
              --format jsonl|json    JSON lines (append) or one pretty JSON array (default: jsonl).
              --clear                Delete existing files in the output directory first.
              --raw-html             Store the raw HTML in every record.
              --jsoup                Extract links with the jsoup parser instead of the regex scanner.
              --timeout-ms N         Per-request timeout in milliseconds (default: 10000).
              -A, --user-agent STR   User-Agent header.
              --config FILE          Load settings from a crawl.yml file.
              -v, --verbose          Debug logging.
              -q, --quiet            Warnings only.
              -h, --help             Show this help.

            Example:
              spiderman https://example.com --max-pages 50 --same-domain --out output
            """;

    String seed;
    Integer maxPages;
    final List<String> allowDomains = new ArrayList<>();
    boolean sameDomain;
    Path outDir;
    String file;
    boolean autoName;
    OutputFormat format;
    boolean clear;
    boolean rawHtml;
    boolean jsoup;
    Long timeoutMs;
    String userAgent;
    Path configFile;
    int verbosity;          // -1 quiet, 0 기본, 1 verbose
    boolean help;

    private CliOptions() {}

    public static CliOptions parse(String[] args) throws UsageException {
        CliOptions o = new CliOptions();
        for (int i = 0; i < args.length; i++) {
            String arg = args[i];
            try {
                switch (arg) {
                    case "-h", "--help" -> o.help = true;
                    case "--max-pages" -> o.maxPages = Integer.parseInt(args[++i]);
                    case "--allow-domain" -> o.allowDomains.add(args[++i]);
                    case "--same-domain" -> o.sameDomain = true;
                    case "--out" -> o.outDir = Path.of(args[++i]);
                    case "--file" -> o.file = args[++i];
                    case "--auto-name" -> o.autoName = true;
                    case "--format" -> o.format = parseFormat(args[++i]);
                    case "--clear" -> o.clear = true;
                    case "--raw-html" -> o.rawHtml = true;
                    case "--jsoup" -> o.jsoup = true;
                    case "--timeout-ms" -> o.timeoutMs = Long.parseLong(args[++i]);
                    case "-A", "--user-agent" -> o.userAgent = args[++i];
                    case "--config" -> o.configFile = Path.of(args[++i]);
                    case "-v", "--verbose" -> o.verbosity = 1;
                    case "-q", "--quiet" -> o.verbosity = -1;
                    default -> {
                        if (arg.startsWith("-")) throw new UsageException("unknown option " + arg);
                        if (o.seed != null) throw new UsageException("only one seed URL is allowed: " + arg);
                        o.seed = arg;
                    }
                }
            } catch (ArrayIndexOutOfBoundsException e) {
                throw new UsageException("missing value for option " + arg, e);
            } catch (NumberFormatException e) {
                throw new UsageException("invalid number for option " + arg + ": " + args[i], e);
            }
        }
        if (o.file != null && o.autoName) throw new UsageException("--file and --auto-name are mutually exclusive");
        return o;
    }

    private static OutputFormat parseFormat(String s) throws UsageException {
        switch (s.trim().toLowerCase(Locale.ROOT)) {
            case "jsonl": return OutputFormat.JSONL;
            case "json":  return OutputFormat.JSON;
            default: throw new UsageException("unknown format: " + s + " (expected jsonl or json)");
        }
    }

    /**
     * YAML(있으면) 위에 플래그를 덮어써서 검증된 설정 생성.
     * @param startedAt --auto-name 파일명 타임스탬프
     */
    public CrawlConfig toConfig(Instant startedAt) throws UsageException {
        CrawlConfig.Builder b;
        if (configFile != null) {
            try {
                b = YamlConfigLoader.loadBuilder(configFile);
            } catch (IOException e) {
                throw new UsageException(e.getMessage(), e);
            } catch (IllegalArgumentException e) {
                throw new UsageException(configFile + ": " + e.getMessage(), e);
            }
        } else {
            b = CrawlConfig.builder();
        }

        if (seed != null) b.seed(seed);
        if (b.getSeed() == null) throw new UsageException("missing seed URL");

        if (maxPages != null) b.maxPages(maxPages);
        for (String d : allowDomains) b.allowDomain(d);
        if (sameDomain) {
            String host = UrlUtils.extractDomain(UrlUtils.normalize(b.getSeed()))
                    .orElseThrow(() -> new UsageException("cannot determine host of seed: " + b.getSeed()));
            b.allowDomain(host);
        }
        if (outDir != null) b.outputDir(outDir);
        if (format != null) b.outputFormat(format);
        if (rawHtml) b.includeRawHtml(true);
        if (jsoup) b.linkExtractor(LinkExtractorKind.JSOUP);
        if (timeoutMs != null) b.timeoutMs(timeoutMs);
        if (userAgent != null) b.userAgent(userAgent);

        if (file != null) {
            b.outputFile(file);
        } else if (autoName) {
            b.outputFile(ExportNaming.fileName(b.getSeed(), startedAt, effectiveFormat(b)));
        } else if (format == OutputFormat.JSON && configFile == null) {
            b.outputFile("crawl.json");
        }

        try {
            return b.build();
        } catch (IllegalArgumentException | NullPointerException e) {
            throw new UsageException(e.getMessage(), e);
        }
    }

    private OutputFormat effectiveFormat(CrawlConfig.Builder b) {
        return (format != null) ? format : b.getOutputFormat();
    }

    public boolean isHelp() { return help; }
    public boolean isClear() { return clear; }
    public int getVerbosity() { return verbosity; }
}
