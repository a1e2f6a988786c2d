package com.streamscout.core.validate;

import com.streamscout.core.api.IStreamProbe;
import com.streamscout.core.model.Candidate;
import com.streamscout.core.model.HarvestStats;
import com.streamscout.core.model.ProbeOutcome;
import com.streamscout.core.model.ValidationResult;
import com.streamscout.core.util.BoundedExecutors;
import com.streamscout.core.util.StructuredLog;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.concurrent.*;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * url 단위 메모이즈 검증기.
 * - 같은 url은 실행(run) 동안 한 번만 프로브한다. 동시에 들어온 호출은 진행 중인 프로브 하나를 공유.
 * - 메모 맵의 putIfAbsent가 유일한 동기화 지점.
 * - submit()은 검색과 독립된 전용 풀(validate-N)에서 돌린다.
 */
public final class StreamValidator implements AutoCloseable {

    private static final Logger LOG = LoggerFactory.getLogger(StreamValidator.class);
    private static final StructuredLog SLOG = StructuredLog.get(StreamValidator.class);

    private final IStreamProbe probe;
    private final HarvestStats stats;
    private final ExecutorService pool;
    private final ConcurrentHashMap<String, CompletableFuture<ProbeOutcome>> memo = new ConcurrentHashMap<>();
    private final AtomicInteger inFlight = new AtomicInteger(0);

    public StreamValidator(IStreamProbe probe, int concurrency) {
        this(probe, concurrency, new HarvestStats());
    }

    public StreamValidator(IStreamProbe probe, int concurrency, HarvestStats stats) {
        this.probe = Objects.requireNonNull(probe, "probe");
        this.stats = Objects.requireNonNull(stats, "stats");
        int cc = Math.max(1, concurrency);
        this.pool = BoundedExecutors.newBlocking(cc, cc * 4, "validate");
    }

    /** 호출 스레드에서 동기 검증(메모 적중 시 네트워크 없음) */
    public boolean validate(String url) {
        return outcome(url).isValid();
    }

    /** 메모된 프로브 결과. 최초 호출자만 실제 프로브를 수행한다. */
    public ProbeOutcome outcome(String url) {
        Objects.requireNonNull(url, "url");
        CompletableFuture<ProbeOutcome> mine = new CompletableFuture<>();
        CompletableFuture<ProbeOutcome> existing = memo.putIfAbsent(url, mine);
        if (existing != null) {
            return existing.join();
        }
        try {
            mine.complete(runProbe(url));
        } catch (Error e) {
            // 메모는 항상 완료(후속 호출자 대기 방지)
            mine.complete(ProbeOutcome.failed(url, e));
            if (e instanceof VirtualMachineError) throw e;
            LOG.warn("Probe aborted {}: {}", url, e.toString());
        }
        return mine.join();
    }

    /** 전용 풀에서 비동기 검증 */
    public CompletableFuture<ValidationResult> submit(Candidate candidate) {
        Objects.requireNonNull(candidate, "candidate");
        return CompletableFuture.supplyAsync(
                () -> new ValidationResult(candidate, validate(candidate.url())), pool);
    }

    /** 지금까지 프로브된 고유 url 수 */
    public int probedCount() {
        return memo.size();
    }

    private ProbeOutcome runProbe(String url) {
        int cur = inFlight.incrementAndGet();
        stats.observeProbeConcurrency(cur);
        long t0 = System.nanoTime();
        ProbeOutcome out;
        try {
            out = probe.probe(url);
            if (out == null) out = ProbeOutcome.failed(url, new IllegalStateException("probe returned null"));
        } catch (RuntimeException e) {
            // 계약상 프로브는 예외를 던지지 않지만, 던지더라도 무효로 닫는다
            out = ProbeOutcome.failed(url, e);
        } finally {
            inFlight.decrementAndGet();
        }
        long ms = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - t0);
        stats.probeDone(ms);

        if (out.isValid()) {
            LOG.debug("Probe ok {} ({}, {}ms)", url, out.getReason(), ms);
        } else {
            LOG.debug("Probe rejected {} ({}, status={}{})", url, out.getReason(), out.getStatus(),
                    out.getError().map(e -> ", " + e).orElse(""));
        }
        SLOG.event(StructuredLog.Event.PROBE_DONE)
                .url(url)
                .flag("valid", out.isValid())
                .status(out.getStatus())
                .with("reason", out.getReason().name())
                .millis(ms)
                .log();
        return out;
    }

    @Override
    public void close() {
        BoundedExecutors.shutdown(pool, 10);
    }
}
