package com.streamscout.app.report;

import com.streamscout.core.model.HarvestStats;
import com.streamscout.core.model.RunOutcome;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/** JSON 실행 리포트 DTO (Jackson 직렬화용, 공개 필드) */
public final class RunReport {
    public String v = "1";
    public Instant startedAt;
    public Instant finishedAt;
    public long durationMs;
    public String outputFile;
    public int discovered;
    public int unique;
    public int valid;
    public Map<String, ChannelStat> channels = new LinkedHashMap<>();
    public Stats stats;

    public static final class ChannelStat {
        public int discovered;
        public int valid;

        public ChannelStat() {}

        ChannelStat(int discovered, int valid) {
            this.discovered = discovered;
            this.valid = valid;
        }
    }

    public static final class Stats {
        public long pagesFetched;
        public long fetchFailures;
        public long pagesSkipped;
        public long probes;
        public long avgProbeMs;
        public int maxFetchConcurrency;
        public int maxProbeConcurrency;
    }

    public static RunReport from(RunOutcome o) {
        RunReport r = new RunReport();
        r.startedAt = o.getStartedAt();
        r.finishedAt = o.getFinishedAt();
        r.durationMs = Math.max(0, o.getFinishedAt().toEpochMilli() - o.getStartedAt().toEpochMilli());
        r.outputFile = (o.getOutputFile() == null) ? null : o.getOutputFile().toString();
        r.discovered = o.getDiscovered();
        r.unique = o.getUnique();
        r.valid = o.getValidated();
        o.getPerChannel().forEach((ch, c) -> r.channels.put(ch, new ChannelStat(c.discovered(), c.valid())));

        HarvestStats.Snapshot s = o.getStats();
        if (s != null) {
            Stats st = new Stats();
            st.pagesFetched = s.pagesFetched;
            st.fetchFailures = s.fetchFailures;
            st.pagesSkipped = s.pagesSkipped;
            st.probes = s.probesTotal;
            st.avgProbeMs = s.avgProbeMs;
            st.maxFetchConcurrency = s.maxObservedFetchConcurrency;
            st.maxProbeConcurrency = s.maxObservedProbeConcurrency;
            r.stats = st;
        }
        return r;
    }
}
