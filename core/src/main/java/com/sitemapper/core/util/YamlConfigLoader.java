package com.sitemapper.core.util;

import com.sitemapper.core.model.CrawlConfig;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.SafeConstructor;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Map;
import java.util.Objects;
import java.util.function.Consumer;
import java.util.function.IntConsumer;

/**
 * crawl.yml 을 읽어 CrawlConfig 로 변환.
 *
 * 예상 YAML 키:
 * target: "https://example.com"
 * timeoutMs: 5000
 * workers: 8
 * followRedirects: true
 * userAgent: "SiteMapper/0.1"
 * verbose: false
 * scope:
 *   maxDepth: 0      # 0 이하 = 무제한
 *
 * target 은 CLI 인자로 줄 수 있으므로 여기서는 validate() 를 호출하지 않는다.
 */
public final class YamlConfigLoader {

    private YamlConfigLoader() {}

    public static CrawlConfig load(Path yamlPath) throws IOException {
        Objects.requireNonNull(yamlPath, "yamlPath");
        if (!Files.exists(yamlPath)) {
            throw new IOException("crawl.yml not found at: " + yamlPath.toAbsolutePath());
        }
        try (InputStream in = Files.newInputStream(yamlPath)) {
            return load(in);
        }
    }

    public static CrawlConfig load(InputStream in) {
        Yaml yaml = new Yaml(new SafeConstructor(new LoaderOptions()));
        Object root = yaml.load(in);

        CrawlConfig cfg = CrawlConfig.defaults();
        if (!(root instanceof Map<?, ?> map)) {
            // 비어있거나 단순 스칼라면 defaults 유지
            return cfg;
        }

        // 1) 평면 키
        setString(map, "target", cfg::setTarget);
        setIntAsDurationMs(map, "timeoutMs", cfg::setTimeout);
        setInt(map, "workers", cfg::setWorkers);
        setBoolean(map, "followRedirects", cfg::setFollowRedirects);
        setString(map, "userAgent", cfg::setUserAgent);
        setBoolean(map, "verbose", cfg::setVerbose);

        // 2) scope.maxDepth
        Object scope = map.get("scope");
        if (scope instanceof Map<?, ?> s) {
            setInt(s, "maxDepth", cfg::setMaxDepth);
        }
        return cfg;
    }

    // ------------ helpers ------------
    private static void setString(Map<?, ?> map, String key, Consumer<String> setter) {
        Object v = map.get(key);
        if (v != null) setter.accept(String.valueOf(v));
    }

    private static void setBoolean(Map<?, ?> map, String key, Consumer<Boolean> setter) {
        Object v = map.get(key);
        if (v instanceof Boolean b) setter.accept(b);
        else if (v != null) setter.accept(Boolean.parseBoolean(String.valueOf(v)));
    }

    private static void setInt(Map<?, ?> map, String key, IntConsumer setter) {
        Object v = map.get(key);
        if (v instanceof Number n) setter.accept(n.intValue());
        else if (v != null) setter.accept(parseInt(key, String.valueOf(v)));
    }

    private static void setIntAsDurationMs(Map<?, ?> map, String key, Consumer<Duration> setter) {
        Object v = map.get(key);
        if (v == null) return;
        long ms = (v instanceof Number n) ? n.longValue() : parseInt(key, String.valueOf(v));
        if (ms > 0) setter.accept(Duration.ofMillis(ms));
    }

    private static int parseInt(String key, String raw) {
        try {
            return Integer.parseInt(raw.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(key + " must be an integer: " + raw, e);
        }
    }
}
