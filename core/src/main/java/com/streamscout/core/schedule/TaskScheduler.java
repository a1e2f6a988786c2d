package com.streamscout.core.schedule;

import com.streamscout.core.api.FetchException;
import com.streamscout.core.api.ISearchFetcher;
import com.streamscout.core.dedupe.Deduplicator;
import com.streamscout.core.extract.LinkExtractor;
import com.streamscout.core.model.Candidate;
import com.streamscout.core.model.HarvestStats;
import com.streamscout.core.model.Task;
import com.streamscout.core.util.BoundedExecutors;
import com.streamscout.core.util.Sleeper;
import com.streamscout.core.util.StructuredLog;
import com.streamscout.core.util.StructuredLog.Event;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.*;
import java.util.concurrent.*;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Consumer;

/**
 * (채널, 페이지) 작업을 만들고 fetch → 추출을 제한된 동시성으로 돌린다.
 *  - 채널 팬아웃: 외부 풀(search-channel-N), 크기 = channelConcurrency
 *  - 페이지 팬아웃: 공유 페이지 풀(search-page-N) + 채널별 세마포어(pageConcurrency)
 *  - 조기 종료: 정상 응답인데 후보 0개인 페이지가 나오면 그 뒤 페이지(미시작)는 건너뜀
 *  - 페이싱: 같은 채널의 연속 페이지 사이에 대기(첫 페이지 제외)
 *  - fetch 실패는 작업 단위로 격리: 로그 후 후보 0개로 취급, 조기 종료는 걸지 않음
 */
public final class TaskScheduler {

    private static final Logger LOG = LoggerFactory.getLogger(TaskScheduler.class);
    private static final StructuredLog SLOG = StructuredLog.get(TaskScheduler.class);

    private final ISearchFetcher fetcher;
    private final LinkExtractor extractor;
    private final int channelConcurrency;
    private final int pageConcurrency;
    private final boolean earlyStop;
    private final Sleeper sleeper;
    private final HarvestStats stats;

    private final AtomicInteger inFlight = new AtomicInteger(0);

    public TaskScheduler(ISearchFetcher fetcher,
                         LinkExtractor extractor,
                         int channelConcurrency,
                         int pageConcurrency,
                         boolean earlyStop,
                         Sleeper sleeper,
                         HarvestStats stats) {
        this.fetcher = Objects.requireNonNull(fetcher, "fetcher");
        this.extractor = Objects.requireNonNull(extractor, "extractor");
        this.channelConcurrency = Math.max(1, channelConcurrency);
        this.pageConcurrency = Math.max(1, pageConcurrency);
        this.earlyStop = earlyStop;
        this.sleeper = Objects.requireNonNull(sleeper, "sleeper");
        this.stats = Objects.requireNonNull(stats, "stats");
    }

    /** 채널 순서대로 1..pages 작업 나열 */
    public static List<Task> enumerate(List<String> channels, int pagesPerChannel) {
        List<Task> out = new ArrayList<>(channels.size() * Math.max(0, pagesPerChannel));
        for (String ch : channels) {
            for (int p = 1; p <= pagesPerChannel; p++) out.add(new Task(ch, p));
        }
        return out;
    }

    /** 수집 후 url 기준 병합(first-seen-wins)한 결과 */
    public Set<Candidate> run(List<String> channels, int pagesPerChannel, Duration pacing) {
        Deduplicator dedup = new Deduplicator();
        run(channels, pagesPerChannel, pacing, dedup::offer);
        return dedup.snapshot();
    }

    /**
     * 스트리밍 실행: 발견 즉시 sink로 흘려보낸다(sink는 여러 스레드에서 호출됨).
     * @return 추출된 후보 총합(중복 포함)
     */
    public int run(List<String> channels, int pagesPerChannel, Duration pacing, Consumer<Candidate> sink) {
        Objects.requireNonNull(channels, "channels");
        Objects.requireNonNull(sink, "sink");
        if (pagesPerChannel < 1) throw new IllegalArgumentException("pagesPerChannel must be >= 1");
        final Duration gap = (pacing == null || pacing.isNegative()) ? Duration.ZERO : pacing;

        LOG.info("Search start: channels={}, pages={}, pacing={}ms, channelCc={}, pageCc={}, earlyStop={}",
                channels.size(), pagesPerChannel, gap.toMillis(), channelConcurrency, pageConcurrency, earlyStop);

        ExecutorService channelPool = BoundedExecutors.newBlocking(channelConcurrency, Math.max(1, channels.size()), "search-channel");
        int pageThreads = channelConcurrency * pageConcurrency;
        ExecutorService pagePool = BoundedExecutors.newBlocking(pageThreads, pageThreads, "search-page");
        AtomicInteger discovered = new AtomicInteger(0);

        try {
            List<Future<?>> futures = new ArrayList<>(channels.size());
            for (String ch : channels) {
                futures.add(channelPool.submit(
                        () -> runChannel(ch, pagesPerChannel, gap, pagePool, sink, discovered)));
            }
            for (Future<?> f : futures) {
                try {
                    f.get();
                } catch (ExecutionException e) {
                    Throwable cause = (e.getCause() != null ? e.getCause() : e);
                    LOG.warn("Channel task failed: {}", cause.toString());
                    SLOG.event(Event.CHANNEL_FAILED).error(cause).log();
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    break;
                }
            }
        } finally {
            BoundedExecutors.shutdown(channelPool, 30);
            BoundedExecutors.shutdown(pagePool, 30);
        }

        LOG.info("Search done. discovered={}", discovered.get());
        return discovered.get();
    }

    // 채널 하나: 페이지를 순서대로 배분(세마포어로 채널당 동시성 제한)
    private void runChannel(String channel, int pages, Duration pacing, ExecutorService pagePool,
                            Consumer<Candidate> sink, AtomicInteger discovered) {
        // 후보 0개로 끝난 가장 작은 페이지 번호(조기 종료 기준)
        AtomicInteger exhaustedAt = new AtomicInteger(Integer.MAX_VALUE);
        Semaphore permits = new Semaphore(pageConcurrency);
        List<Future<?>> pageFutures = new ArrayList<>(pages);

        try {
            for (int page = 1; page <= pages; page++) {
                if (isExhausted(exhaustedAt, page)) {
                    skip(channel, page, pages);
                    break;
                }
                if (page > 1 && !pacing.isZero()) {
                    sleeper.sleep(pacing);
                }
                permits.acquire();
                if (isExhausted(exhaustedAt, page)) {
                    permits.release();
                    skip(channel, page, pages);
                    break;
                }
                Task task = new Task(channel, page);
                try {
                    pageFutures.add(pagePool.submit(() -> {
                        try {
                            int n = processPage(task, exhaustedAt, sink);
                            discovered.addAndGet(n);
                        } finally {
                            permits.release();
                        }
                    }));
                } catch (RejectedExecutionException e) {
                    permits.release();
                    throw e;
                }
            }
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            LOG.warn("Channel {} interrupted while pacing", channel);
        }

        for (Future<?> f : pageFutures) {
            try {
                f.get();
            } catch (ExecutionException e) {
                Throwable cause = (e.getCause() != null ? e.getCause() : e);
                LOG.warn("Page task failed ({}): {}", channel, cause.toString());
            } catch (InterruptedException ie) {
                Thread.currentThread().interrupt();
                return;
            }
        }
    }

    private boolean isExhausted(AtomicInteger exhaustedAt, int page) {
        return earlyStop && page > exhaustedAt.get();
    }

    private void skip(String channel, int fromPage, int pages) {
        int n = pages - fromPage + 1;
        stats.pagesSkipped(n);
        LOG.debug("Channel {} exhausted; skipping pages {}..{}", channel, fromPage, pages);
    }

    /** fetch + 추출 1건. 실패는 여기서 흡수하고 0 반환. */
    int processPage(Task task, AtomicInteger exhaustedAt, Consumer<Candidate> sink) {
        int cur = inFlight.incrementAndGet();
        stats.observeFetchConcurrency(cur);
        try {
            String text = fetcher.fetch(task);
            stats.pageFetched();

            Set<Candidate> found = extractor.extract(text, task.channel());
            LOG.info("Fetched {} page {} -> links={}", task.channel(), task.page(), found.size());
            SLOG.event(Event.PAGE_FETCHED)
                    .channel(task.channel())
                    .page(task.page())
                    .count("links", found.size())
                    .log();

            if (found.isEmpty()) {
                if (earlyStop) {
                    exhaustedAt.accumulateAndGet(task.page(), Math::min);
                    SLOG.event(Event.CHANNEL_EXHAUSTED).channel(task.channel()).page(task.page()).log();
                }
                return 0;
            }
            for (Candidate c : found) sink.accept(c);
            return found.size();

        } catch (FetchException e) {
            stats.fetchFailed();
            LOG.warn("Fetch failed {} page {}: {}", task.channel(), task.page(), e.getMessage());
            SLOG.event(Event.FETCH_FAILED)
                    .channel(task.channel())
                    .page(task.page())
                    .status(e.getStatus())
                    .error(e)
                    .log();
            return 0;
        } finally {
            inFlight.decrementAndGet();
        }
    }
}
