package com.sitemapper.app.cli;

import java.nio.file.Path;
import java.util.Locale;

/**
 * sitemapper [options] &lt;url&gt; 파싱 결과.
 * 값이 없는 옵션은 null 로 남겨 crawl.yml/기본값을 덮어쓰지 않는다.
 */
public final class CliOptions {

    public enum Format { JSON, SITEMAP }

    static final String USAGE = String.join("\n",
            "Usage: sitemapper [options] <url>",
            "Crawls every page of the given site (same host only) and prints per-page status and links.",
            "",
            "Options:",
            "  --depth N        maximum crawl depth (<= 0: unbounded)",
            "  --workers N      maximum concurrent requests",
            "  --timeout MS     per-request timeout in milliseconds",
            "  --format F       json (default) | sitemap",
            "  --config FILE    crawl.yml to load before applying flags",
            "  --verbose        log every page as it is scanned",
            "  --timed          print elapsed time to stderr",
            "  --help           show this message");

    private String url;
    private Integer depth;
    private Integer workers;
    private Long timeoutMs;
    private Format format = Format.JSON;
    private Path config;
    private boolean verbose;
    private boolean timed;
    private boolean help;

    public String getUrl() { return url; }
    public Integer getDepth() { return depth; }
    public Integer getWorkers() { return workers; }
    public Long getTimeoutMs() { return timeoutMs; }
    public Format getFormat() { return format; }
    public Path getConfig() { return config; }
    public boolean isVerbose() { return verbose; }
    public boolean isTimed() { return timed; }
    public boolean isHelp() { return help; }

    /** @throws IllegalArgumentException 알 수 없는 옵션, 값 누락/형식 오류, url 누락 */
    public static CliOptions parse(String... args) {
        CliOptions o = new CliOptions();
        for (int i = 0; i < args.length; i++) {
            String a = args[i];
            switch (a) {
                case "--help", "-h" -> o.help = true;
                case "--verbose", "-v" -> o.verbose = true;
                case "--timed" -> o.timed = true;
                case "--depth" -> o.depth = intValue(a, value(args, ++i, a));
                case "--workers" -> {
                    o.workers = intValue(a, value(args, ++i, a));
                    if (o.workers < 1) throw new IllegalArgumentException("--workers must be >= 1");
                }
                case "--timeout" -> {
                    o.timeoutMs = (long) intValue(a, value(args, ++i, a));
                    if (o.timeoutMs <= 0) throw new IllegalArgumentException("--timeout must be > 0");
                }
                case "--format" -> o.format = format(value(args, ++i, a));
                case "--config" -> o.config = Path.of(value(args, ++i, a));
                default -> {
                    if (a.startsWith("-")) throw new IllegalArgumentException("unknown option: " + a);
                    if (o.url != null) throw new IllegalArgumentException("only one url may be given");
                    o.url = a;
                }
            }
        }
        if (o.url == null && !o.help && o.config == null) {
            throw new IllegalArgumentException("must provide website url for crawling");
        }
        return o;
    }

    private static String value(String[] args, int i, String opt) {
        if (i >= args.length) throw new IllegalArgumentException(opt + " requires a value");
        return args[i];
    }

    private static int intValue(String opt, String raw) {
        try {
            return Integer.parseInt(raw.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(opt + " expects an integer, got: " + raw, e);
        }
    }

    private static Format format(String raw) {
        String s = raw.trim().toUpperCase(Locale.ROOT);
        if (s.equals("XML")) return Format.SITEMAP;
        try {
            return Format.valueOf(s);
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("--format must be json or sitemap, got: " + raw, e);
        }
    }
}
