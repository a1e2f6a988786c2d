package com.streamscout.core.service;

import com.streamscout.core.api.EmptyPlaylistException;
import com.streamscout.core.api.HarvestException;
import com.streamscout.core.api.ISearchFetcher;
import com.streamscout.core.api.IStreamProbe;
import com.streamscout.core.dedupe.Deduplicator;
import com.streamscout.core.export.PlaylistWriter;
import com.streamscout.core.extract.LinkExtractor;
import com.streamscout.core.extract.PageLinkExtractor;
import com.streamscout.core.model.*;
import com.streamscout.core.schedule.TaskScheduler;
import com.streamscout.core.search.HttpSearchFetcher;
import com.streamscout.core.util.DefaultSleeper;
import com.streamscout.core.util.ProgressListener;
import com.streamscout.core.util.Sleeper;
import com.streamscout.core.util.StructuredLog;
import com.streamscout.core.util.StructuredLog.Event;
import com.streamscout.core.validate.HttpStreamProbe;
import com.streamscout.core.validate.StreamValidator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.*;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.logging.Level;

/**
 * 수집 오케스트레이터:
 *  - search(채널×페이지 fetch + 추출) → dedupe → validate → export
 *  - 새로 보존된 후보는 발견 즉시 검증 풀에 넘긴다(검색과 검증이 겹쳐 진행)
 *  - 유효 항목 0개면 EmptyPlaylistException, 파일은 건드리지 않음
 *  - DI 생성자는 테스트용(fetcher/probe/sleeper 주입)
 */
public final class HarvestService {

    private static final Logger LOG = LoggerFactory.getLogger(HarvestService.class);
    private static final StructuredLog SLOG = StructuredLog.get(HarvestService.class);

    private final HarvestConfig config;
    private final ISearchFetcher fetcher;
    private final LinkExtractor extractor;
    private final IStreamProbe probe;
    private final Sleeper sleeper;

    /** 기본 구현(HTTP fetch/probe, 실제 sleep) */
    public HarvestService(HarvestConfig config) {
        this(config,
                new HttpSearchFetcher(config.search()),
                new PageLinkExtractor(config.getExtension()),
                new HttpStreamProbe(config.validation(), config.search().getUserAgent()),
                new DefaultSleeper());
    }

    /** DI/테스트용 */
    public HarvestService(HarvestConfig config,
                          ISearchFetcher fetcher,
                          LinkExtractor extractor,
                          IStreamProbe probe,
                          Sleeper sleeper) {
        this.config = Objects.requireNonNull(config, "config");
        this.config.validate();
        this.fetcher = Objects.requireNonNull(fetcher, "fetcher");
        this.extractor = Objects.requireNonNull(extractor, "extractor");
        this.probe = Objects.requireNonNull(probe, "probe");
        this.sleeper = Objects.requireNonNull(sleeper, "sleeper");
    }

    public RunOutcome run() {
        return run(ProgressListener.NONE);
    }

    public RunOutcome run(ProgressListener listener) {
        final ProgressListener pl = (listener != null) ? listener : ProgressListener.NONE;
        final Instant startedAt = Instant.now();
        final HarvestConfig.Search s = config.search();
        final List<String> channels = config.getChannels();
        final Duration pacing = s.getPacing();

        LOG.info("Harvest start: channels={}, pages={}, pacing={}ms, validateCc={}",
                channels, s.getPages(), pacing.toMillis(), config.validation().getConcurrency());
        SLOG.event(Event.HARVEST_START)
                .count("channels", channels.size())
                .count("pages", s.getPages())
                .count("pacingMs", pacing.toMillis())
                .count("channelCc", s.getChannelConcurrency())
                .count("pageCc", s.getPageConcurrency())
                .count("validateCc", config.validation().getConcurrency())
                .flag("earlyStop", s.isEarlyStop())
                .log();

        final HarvestStats stats = new HarvestStats();
        final Deduplicator dedup = new Deduplicator();
        final Map<String, AtomicInteger> discoveredByChannel = new ConcurrentHashMap<>();
        final List<CompletableFuture<ValidationResult>> pending = Collections.synchronizedList(new ArrayList<>());
        final AtomicInteger validatedDone = new AtomicInteger(0);

        final TaskScheduler scheduler = new TaskScheduler(fetcher, extractor,
                s.getChannelConcurrency(), s.getPageConcurrency(), s.isEarlyStop(), sleeper, stats);

        final List<ValidationResult> results = new ArrayList<>();
        int discovered;

        try (StreamValidator validator = new StreamValidator(probe, config.validation().getConcurrency(), stats)) {
            // ---- 1) search (+ 보존된 후보는 곧바로 검증 제출) ----
            pl.onProgress(0.0, "search", 0, -1);
            discovered = scheduler.run(channels, s.getPages(), pacing, c -> {
                discoveredByChannel.computeIfAbsent(c.source(), k -> new AtomicInteger()).incrementAndGet();
                if (dedup.offer(c)) {
                    CompletableFuture<ValidationResult> f = validator.submit(c);
                    f.whenComplete((r, e) -> {
                        int done = validatedDone.incrementAndGet();
                        pl.onProgress(0.0, "validate", done, -1);
                    });
                    pending.add(f);
                }
            });
            pl.onProgress(0.5, "search", discovered, discovered);

            // ---- 2) validate: 남은 프로브 대기 ----
            List<CompletableFuture<ValidationResult>> all;
            synchronized (pending) {
                all = new ArrayList<>(pending);
            }
            int total = all.size();
            for (CompletableFuture<ValidationResult> f : all) {
                results.add(f.join());
            }
            pl.onProgress(0.9, "validate", total, total);
        }

        // ---- 3) export ----
        List<PlaylistEntry> entries = new ArrayList<>();
        for (ValidationResult r : results) {
            if (r.valid()) entries.add(PlaylistEntry.from(r.candidate()));
        }
        entries.sort(PlaylistEntry.CHANNEL_ORDER);

        Map<String, RunOutcome.ChannelCount> perChannel = perChannel(channels, discoveredByChannel, entries);
        HarvestStats.Snapshot snap = stats.snapshot();

        if (entries.isEmpty()) {
            LOG.warn("No valid stream links found (discovered={}, unique={}); output left untouched",
                    discovered, dedup.keptCount());
            SLOG.event(Event.HARVEST_DONE)
                    .at(Level.WARNING)
                    .count("discovered", discovered)
                    .count("unique", dedup.keptCount())
                    .count("valid", 0)
                    .flag("written", false)
                    .log();
            throw new EmptyPlaylistException(discovered);
        }

        Path out = config.output().resolvePlaylistPath();
        pl.onProgress(0.95, "export", 0, entries.size());
        try {
            new PlaylistWriter(config.output().getGroupTitle()).write(entries, out);
        } catch (IOException e) {
            throw new HarvestException("failed to write playlist: " + out, e);
        }
        pl.onProgress(1.0, "export", entries.size(), entries.size());

        Instant finishedAt = Instant.now();
        LOG.info("Harvest done: discovered={}, unique={}, valid={}, probes={}, fetchFailures={}, skipped={}, file={}",
                discovered, dedup.keptCount(), entries.size(), snap.probesTotal, snap.fetchFailures,
                snap.pagesSkipped, out);
        SLOG.event(Event.HARVEST_DONE)
                .count("discovered", discovered)
                .count("unique", dedup.keptCount())
                .count("valid", entries.size())
                .flag("written", true)
                .with("file", out.toString())
                .millis(Duration.between(startedAt, finishedAt).toMillis())
                .log();

        return RunOutcome.builder()
                .discovered(discovered)
                .unique(dedup.keptCount())
                .entries(entries)
                .outputFile(out)
                .perChannel(perChannel)
                .stats(snap)
                .startedAt(startedAt)
                .finishedAt(finishedAt)
                .build();
    }

    // 설정된 채널은 0건이어도 포함
    private static Map<String, RunOutcome.ChannelCount> perChannel(List<String> channels,
                                                                  Map<String, AtomicInteger> discovered,
                                                                  List<PlaylistEntry> entries) {
        Map<String, Integer> valid = new HashMap<>();
        for (PlaylistEntry e : entries) valid.merge(e.channel(), 1, Integer::sum);

        Map<String, RunOutcome.ChannelCount> out = new TreeMap<>();
        for (String ch : channels) {
            AtomicInteger d = discovered.get(ch);
            out.put(ch, new RunOutcome.ChannelCount(d == null ? 0 : d.get(), valid.getOrDefault(ch, 0)));
        }
        return out;
    }
}
