package com.streamscout.core.model;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Objects;

/**
 * 수집 설정 (harvest.yml 매핑 대상). 순수 설정 보관용.
 * CLI 옵션은 로딩 후 setter로 덮어쓴다.
 */
public final class HarvestConfig {

    public static final List<String> DEFAULT_CHANNELS = List.of(
            "CCTV1", "CCTV2", "CCTV3", "CCTV4", "CCTV5",
            "CCTV6", "CCTV7", "CCTV8", "CCTV9", "CCTV10");

    /** YAML `search:` 섹션 */
    public static final class Search {
        private String baseUrl = "https://tonkiang.us/";
        private String keywordParam = "iptv";
        private String tokenParam = "l";
        private String pageParam = "page";
        private int pages = 2;
        private Duration pacing = Duration.ZERO;
        private boolean earlyStop = true;
        private int channelConcurrency = 3;
        private int pageConcurrency = 2;
        private Duration connectTimeout = Duration.ofSeconds(5);
        private Duration timeout = Duration.ofSeconds(15);
        private String userAgent = "Mozilla/5.0 (Windows NT 10.0; Win64; x64) AppleWebKit/537.36";
        private String acceptLanguage = "zh-CN,zh;q=0.8,en-US;q=0.5,en;q=0.3";

        public String getBaseUrl() { return baseUrl; }
        public Search setBaseUrl(String v) { this.baseUrl = v; return this; }

        public String getKeywordParam() { return keywordParam; }
        public Search setKeywordParam(String v) { this.keywordParam = v; return this; }

        public String getTokenParam() { return tokenParam; }
        public Search setTokenParam(String v) { this.tokenParam = v; return this; }

        public String getPageParam() { return pageParam; }
        public Search setPageParam(String v) { this.pageParam = v; return this; }

        public int getPages() { return pages; }
        public Search setPages(int v) { this.pages = v; return this; }

        public Duration getPacing() { return pacing; }
        public Search setPacing(Duration v) { this.pacing = (v == null ? Duration.ZERO : v); return this; }

        public boolean isEarlyStop() { return earlyStop; }
        public Search setEarlyStop(boolean v) { this.earlyStop = v; return this; }

        public int getChannelConcurrency() { return channelConcurrency; }
        public Search setChannelConcurrency(int v) { this.channelConcurrency = Math.max(1, v); return this; }

        public int getPageConcurrency() { return pageConcurrency; }
        public Search setPageConcurrency(int v) { this.pageConcurrency = Math.max(1, v); return this; }

        public Duration getConnectTimeout() { return connectTimeout; }
        public Search setConnectTimeout(Duration v) { this.connectTimeout = v; return this; }

        public Duration getTimeout() { return timeout; }
        public Search setTimeout(Duration v) { this.timeout = v; return this; }

        public String getUserAgent() { return userAgent; }
        public Search setUserAgent(String v) { this.userAgent = v; return this; }

        public String getAcceptLanguage() { return acceptLanguage; }
        public Search setAcceptLanguage(String v) { this.acceptLanguage = v; return this; }
    }

    /** YAML `validate:` 섹션 */
    public static final class Validate {
        private int concurrency = 10;
        private Duration connectTimeout = Duration.ofSeconds(3);
        private Duration timeout = Duration.ofSeconds(5);
        private int probeBytes = 512;
        private boolean headFirst = true;

        public int getConcurrency() { return concurrency; }
        public Validate setConcurrency(int v) { this.concurrency = Math.max(1, v); return this; }

        public Duration getConnectTimeout() { return connectTimeout; }
        public Validate setConnectTimeout(Duration v) { this.connectTimeout = v; return this; }

        public Duration getTimeout() { return timeout; }
        public Validate setTimeout(Duration v) { this.timeout = v; return this; }

        public int getProbeBytes() { return probeBytes; }
        public Validate setProbeBytes(int v) { this.probeBytes = v; return this; }

        public boolean isHeadFirst() { return headFirst; }
        public Validate setHeadFirst(boolean v) { this.headFirst = v; return this; }
    }

    /** YAML `output:` 섹션 */
    public static final class Output {
        private Path dir = Path.of("output");
        private String file = "ysws.m3u";
        private String groupTitle = "CCTV";
        private boolean report = false;

        public Path getDir() { return dir; }
        public Output setDir(Path v) { this.dir = v; return this; }

        public String getFile() { return file; }
        public Output setFile(String v) { this.file = v; return this; }

        public String getGroupTitle() { return groupTitle; }
        public Output setGroupTitle(String v) { this.groupTitle = v; return this; }

        public boolean isReport() { return report; }
        public Output setReport(boolean v) { this.report = v; return this; }

        /** dir/file */
        public Path resolvePlaylistPath() { return dir.resolve(file); }
    }

    // ---------- 기본 필드 ----------
    private List<String> channels = DEFAULT_CHANNELS;
    private String extension = "m3u8";

    private final Search search = new Search();
    private final Validate validate = new Validate();
    private final Output output = new Output();

    // ---------- getters ----------
    public List<String> getChannels() { return channels; }
    public String getExtension() { return extension; }
    public Search search() { return search; }
    public Validate validation() { return validate; }
    public Output output() { return output; }

    // ---------- fluent setters ----------
    public HarvestConfig setChannels(List<String> channels) {
        if (channels != null && !channels.isEmpty()) this.channels = List.copyOf(channels);
        return this;
    }

    public HarvestConfig setExtension(String extension) {
        this.extension = extension;
        return this;
    }

    // ---------- validate ----------
    public void validate() {
        Objects.requireNonNull(channels, "channels");
        if (channels.isEmpty()) throw new IllegalArgumentException("channels must not be empty");
        for (String c : channels) {
            if (c == null || c.isBlank()) throw new IllegalArgumentException("channels must not contain blank names");
        }
        if (extension == null || extension.isBlank() || extension.contains("."))
            throw new IllegalArgumentException("extension must be a bare suffix like 'm3u8'");

        Objects.requireNonNull(search.getBaseUrl(), "search.baseUrl");
        if (search.getKeywordParam() == null || search.getKeywordParam().isBlank())
            throw new IllegalArgumentException("search.keywordParam must not be blank");
        if (search.getPages() < 1) throw new IllegalArgumentException("search.pages must be >= 1");
        if (search.getPacing().isNegative()) throw new IllegalArgumentException("search.pacingMs must be >= 0");
        requirePositive(search.getConnectTimeout(), "search.connectTimeoutMs");
        requirePositive(search.getTimeout(), "search.timeoutMs");

        requirePositive(validate.getConnectTimeout(), "validate.connectTimeoutMs");
        requirePositive(validate.getTimeout(), "validate.timeoutMs");
        if (validate.getProbeBytes() < 16 || validate.getProbeBytes() > 64 * 1024)
            throw new IllegalArgumentException("validate.probeBytes must be in [16, 65536]");

        Objects.requireNonNull(output.getDir(), "output.dir");
        if (output.getFile() == null || output.getFile().isBlank())
            throw new IllegalArgumentException("output.file must not be blank");
        Objects.requireNonNull(output.getGroupTitle(), "output.groupTitle");
    }

    private static void requirePositive(Duration d, String key) {
        if (d == null || d.isNegative() || d.isZero())
            throw new IllegalArgumentException(key + " must be > 0");
    }

    // ---------- helpers ----------
    public static HarvestConfig defaults() { return new HarvestConfig(); }
}
