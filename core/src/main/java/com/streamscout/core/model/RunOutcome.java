package com.streamscout.core.model;

import java.nio.file.Path;
import java.time.Instant;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/** 실행 결과 요약: 호출자에게 돌려주는 신호(발견/검증 수, 출력 경로). */
public final class RunOutcome {

    /** 채널별 집계 */
    public record ChannelCount(int discovered, int valid) {}

    private final int discovered;          // 추출된 후보 총합(중복 포함)
    private final int unique;              // 중복 제거 후
    private final List<PlaylistEntry> entries;
    private final Path outputFile;
    private final Map<String, ChannelCount> perChannel;
    private final HarvestStats.Snapshot stats;
    private final Instant startedAt;
    private final Instant finishedAt;

    private RunOutcome(Builder b) {
        this.discovered = b.discovered;
        this.unique = b.unique;
        this.entries = (b.entries == null) ? List.of() : List.copyOf(b.entries);
        this.outputFile = b.outputFile;
        this.perChannel = (b.perChannel == null)
                ? Map.of()
                : Collections.unmodifiableMap(new TreeMap<>(b.perChannel));
        this.stats = b.stats;
        this.startedAt = b.startedAt;
        this.finishedAt = b.finishedAt;
    }

    public int getDiscovered() { return discovered; }
    public int getUnique() { return unique; }
    /** 검증 통과 후 실제 기록된 항목 수 */
    public int getValidated() { return entries.size(); }
    public List<PlaylistEntry> getEntries() { return entries; }
    public Path getOutputFile() { return outputFile; }
    public Map<String, ChannelCount> getPerChannel() { return perChannel; }
    public HarvestStats.Snapshot getStats() { return stats; }
    public Instant getStartedAt() { return startedAt; }
    public Instant getFinishedAt() { return finishedAt; }

    // ----- 빌더 -----
    public static Builder builder() { return new Builder(); }

    public static final class Builder {
        private int discovered;
        private int unique;
        private List<PlaylistEntry> entries;
        private Path outputFile;
        private Map<String, ChannelCount> perChannel;
        private HarvestStats.Snapshot stats;
        private Instant startedAt;
        private Instant finishedAt;

        public Builder discovered(int v) { this.discovered = v; return this; }
        public Builder unique(int v) { this.unique = v; return this; }
        public Builder entries(List<PlaylistEntry> v) { this.entries = v; return this; }
        public Builder outputFile(Path v) { this.outputFile = v; return this; }
        public Builder perChannel(Map<String, ChannelCount> v) { this.perChannel = v; return this; }
        public Builder stats(HarvestStats.Snapshot v) { this.stats = v; return this; }
        public Builder startedAt(Instant v) { this.startedAt = v; return this; }
        public Builder finishedAt(Instant v) { this.finishedAt = v; return this; }

        public RunOutcome build() {
            Objects.requireNonNull(startedAt, "startedAt");
            Objects.requireNonNull(finishedAt, "finishedAt");
            return new RunOutcome(this);
        }
    }
}
