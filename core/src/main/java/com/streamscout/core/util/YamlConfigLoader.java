package com.streamscout.core.util;

import com.streamscout.core.model.HarvestConfig;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.SafeConstructor;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.*;
import java.util.function.Consumer;
import java.util.function.IntConsumer;

/**
 * harvest.yml을 읽어 HarvestConfig로 변환.
 *
 * 예상 YAML 키:
 * channels: ["CCTV1", "CCTV2"]      # 또는 "CCTV1,CCTV2"
 * extension: m3u8
 * search:
 *   baseUrl: "https://tonkiang.us/"
 *   keywordParam: iptv
 *   tokenParam: l
 *   pageParam: page
 *   pages: 4
 *   pacingMs: 8000
 *   earlyStop: true
 *   channelConcurrency: 3
 *   pageConcurrency: 2
 *   connectTimeoutMs: 5000
 *   timeoutMs: 15000
 *   userAgent: "..."
 * validate:
 *   concurrency: 10
 *   connectTimeoutMs: 3000
 *   timeoutMs: 5000
 *   probeBytes: 512
 *   headFirst: true
 * output:
 *   dir: output
 *   file: ysws.m3u
 *   groupTitle: CCTV
 *   report: false
 */
public final class YamlConfigLoader {

    public static final String DEFAULT_FILE = "harvest.yml";

    private YamlConfigLoader() {}

    public static HarvestConfig loadDefault() throws IOException {
        return load(Path.of(DEFAULT_FILE));
    }

    public static HarvestConfig load(Path yamlPath) throws IOException {
        Objects.requireNonNull(yamlPath, "yamlPath");
        if (!Files.exists(yamlPath)) {
            throw new IOException(DEFAULT_FILE + " not found at: " + yamlPath.toAbsolutePath());
        }
        try (InputStream in = Files.newInputStream(yamlPath)) {
            return load(in);
        }
    }

    public static HarvestConfig load(InputStream in) {
        Objects.requireNonNull(in, "in");
        LoaderOptions opts = new LoaderOptions();
        Yaml yaml = new Yaml(new SafeConstructor(opts));
        Object root;
        try {
            root = yaml.load(in);
        } catch (YAMLException e) {
            // 문법 오류도 설정 오류로 취급(CLI 종료 코드 2)
            throw new IllegalArgumentException("invalid " + DEFAULT_FILE + ": " + e.getMessage(), e);
        }

        HarvestConfig cfg = HarvestConfig.defaults();

        if (!(root instanceof Map<?, ?> map)) {
            // 비어있거나 단순 스칼라면 defaults 유지
            cfg.validate();
            return cfg;
        }

        // 1) 평면 키
        setStringList(map, "channels", cfg::setChannels);
        setString(map, "extension", cfg::setExtension);

        // 2) search.*
        Map<String, Object> search = getMap(map, "search");
        if (search != null) {
            var s = cfg.search();
            setString(search, "baseUrl", s::setBaseUrl);
            setString(search, "keywordParam", s::setKeywordParam);
            setString(search, "tokenParam", s::setTokenParam);
            setString(search, "pageParam", s::setPageParam);
            setInt(search, "pages", s::setPages);
            setMs(search, "pacingMs", true, s::setPacing);
            setBoolean(search, "earlyStop", s::setEarlyStop);
            setInt(search, "channelConcurrency", s::setChannelConcurrency);
            setInt(search, "pageConcurrency", s::setPageConcurrency);
            setMs(search, "connectTimeoutMs", false, s::setConnectTimeout);
            setMs(search, "timeoutMs", false, s::setTimeout);
            setString(search, "userAgent", s::setUserAgent);
            setString(search, "acceptLanguage", s::setAcceptLanguage);
        }

        // 3) validate.*
        Map<String, Object> validate = getMap(map, "validate");
        if (validate != null) {
            var v = cfg.validation();
            setInt(validate, "concurrency", v::setConcurrency);
            setMs(validate, "connectTimeoutMs", false, v::setConnectTimeout);
            setMs(validate, "timeoutMs", false, v::setTimeout);
            setInt(validate, "probeBytes", v::setProbeBytes);
            setBoolean(validate, "headFirst", v::setHeadFirst);
        }

        // 4) output.*
        Map<String, Object> output = getMap(map, "output");
        if (output != null) {
            var o = cfg.output();
            setPath(output, "dir", o::setDir);
            setString(output, "file", o::setFile);
            setString(output, "groupTitle", o::setGroupTitle);
            setBoolean(output, "report", o::setReport);
        }

        // 기본값/필수값 확인
        cfg.validate();
        return cfg;
    }

    // ------------ helpers ------------
    @SuppressWarnings("unchecked")
    private static Map<String, Object> getMap(Map<?, ?> map, String key) {
        Object v = map.get(key);
        if (v instanceof Map<?, ?> m) return (Map<String, Object>) m;
        return null;
    }

    private static void setString(Map<?, ?> map, String key, Consumer<String> setter) {
        Object v = map.get(key);
        if (v != null) setter.accept(String.valueOf(v));
    }

    /** 리스트 또는 "a,b,c" 문자열 */
    public static List<String> toStringList(Object v) {
        List<String> out = new ArrayList<>();
        if (v == null) return out;
        if (v instanceof List<?> list) {
            for (Object o : list) {
                if (o == null) continue;
                String s = String.valueOf(o).trim();
                if (!s.isEmpty()) out.add(s);
            }
            return out;
        }
        String s = String.valueOf(v).trim();
        if (!s.isEmpty()) {
            for (String p : s.split("\\s*,\\s*")) if (!p.isEmpty()) out.add(p);
        }
        return out;
    }

    private static void setStringList(Map<?, ?> map, String key, Consumer<List<String>> setter) {
        List<String> out = toStringList(map.get(key));
        if (!out.isEmpty()) setter.accept(List.copyOf(out));
    }

    private static void setBoolean(Map<?, ?> map, String key, Consumer<Boolean> setter) {
        Object v = map.get(key);
        if (v instanceof Boolean b) setter.accept(b);
        else if (v != null) setter.accept(Boolean.parseBoolean(String.valueOf(v)));
    }

    private static void setInt(Map<?, ?> map, String key, IntConsumer setter) {
        Object v = map.get(key);
        if (v instanceof Number n) setter.accept(n.intValue());
        else if (v != null) setter.accept(Integer.parseInt(String.valueOf(v).trim()));
    }

    /**
     * 밀리초 정수 → Duration.
     * raw=true면 그대로 반영(음수는 validate()에서 거부), 아니면 0 이하는 무시(기본값 유지).
     */
    private static void setMs(Map<?, ?> map, String key, boolean raw, Consumer<Duration> setter) {
        Object v = map.get(key);
        if (v == null) return;
        long ms = (v instanceof Number n) ? n.longValue() : Long.parseLong(String.valueOf(v).trim());
        if (raw || ms > 0) setter.accept(Duration.ofMillis(ms));
    }

    private static void setPath(Map<?, ?> map, String key, Consumer<Path> setter) {
        Object v = map.get(key);
        if (v != null) setter.accept(Path.of(String.valueOf(v)));
    }
}
