package com.streamscout.core.model;

import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/** 런타임 텔레메트리 누적기 (스레드 세이프). */
public final class HarvestStats {
    private final AtomicLong pagesFetched   = new AtomicLong(0);  // 성공한 검색 페이지 수
    private final AtomicLong fetchFailures  = new AtomicLong(0);  // 실패(타임아웃/전송/비2xx) 페이지 수
    private final AtomicLong pagesSkipped   = new AtomicLong(0);  // 조기 종료로 건너뛴 페이지 수
    private final AtomicLong probesTotal    = new AtomicLong(0);  // 실제 네트워크 프로브 수(메모 적중 제외)
    private final AtomicLong sumProbeMs     = new AtomicLong(0);
    private final AtomicInteger maxObservedFetchConcurrency = new AtomicInteger(0);
    private final AtomicInteger maxObservedProbeConcurrency = new AtomicInteger(0);

    public void pageFetched()  { pagesFetched.incrementAndGet(); }
    public void fetchFailed()  { fetchFailures.incrementAndGet(); }
    public void pagesSkipped(long n) { if (n > 0) pagesSkipped.addAndGet(n); }

    public void probeDone(long wallMs) {
        probesTotal.incrementAndGet();
        sumProbeMs.addAndGet(Math.max(0, wallMs));
    }

    /** 현재 동시 fetch 수를 관측하여 최대값 갱신 */
    public void observeFetchConcurrency(int current) {
        maxObservedFetchConcurrency.accumulateAndGet(current, Math::max);
    }

    public void observeProbeConcurrency(int current) {
        maxObservedProbeConcurrency.accumulateAndGet(current, Math::max);
    }

    public Snapshot snapshot() {
        long probes = probesTotal.get();
        long avgProbeMs = sumProbeMs.get() / Math.max(1, probes);
        return new Snapshot(pagesFetched.get(), fetchFailures.get(), pagesSkipped.get(),
                probes, avgProbeMs,
                maxObservedFetchConcurrency.get(), maxObservedProbeConcurrency.get());
    }

    /** 불변 스냅샷 DTO */
    public static final class Snapshot {
        public final long pagesFetched;
        public final long fetchFailures;
        public final long pagesSkipped;
        public final long probesTotal;
        public final long avgProbeMs;
        public final int  maxObservedFetchConcurrency;
        public final int  maxObservedProbeConcurrency;

        public Snapshot(long pagesFetched, long fetchFailures, long pagesSkipped,
                        long probesTotal, long avgProbeMs, int maxFetchCc, int maxProbeCc) {
            this.pagesFetched = pagesFetched;
            this.fetchFailures = fetchFailures;
            this.pagesSkipped = pagesSkipped;
            this.probesTotal = probesTotal;
            this.avgProbeMs = avgProbeMs;
            this.maxObservedFetchConcurrency = maxFetchCc;
            this.maxObservedProbeConcurrency = maxProbeCc;
        }
    }
}
