package com.streamscout.core.dedupe;

import com.streamscout.core.model.Candidate;

import java.util.*;

/**
 * url 기준 중복 제거, first-seen-wins.
 * 같은 url이 다른 채널에서 다시 들어오면 먼저 들어온 채널 라벨을 유지하고 뒤의 것은 조용히 버린다.
 *
 * 삽입은 단일 락으로 보호(락 범위 = 삽입 1건). 워커 join 이후의 읽기는 snapshot()으로.
 */
public final class Deduplicator {

    private final Object lock = new Object();
    private final Map<String, Candidate> byUrl = new LinkedHashMap<>();
    private int offered;
    private int dropped;

    /** @return url이 처음이면 true(보존), 중복이면 false(버림) */
    public boolean offer(Candidate c) {
        Objects.requireNonNull(c, "candidate");
        synchronized (lock) {
            offered++;
            if (byUrl.putIfAbsent(c.url(), c) == null) return true;
            dropped++;
            return false;
        }
    }

    /** 일괄 병합. 반환값은 이번 호출 이후의 전체 보존 집합(삽입 순서). */
    public Set<Candidate> merge(Collection<Candidate> candidates) {
        Objects.requireNonNull(candidates, "candidates");
        for (Candidate c : candidates) offer(c);
        return snapshot();
    }

    /** 보존된 후보(삽입 순서) 복사본 */
    public Set<Candidate> snapshot() {
        synchronized (lock) {
            return Collections.unmodifiableSet(new LinkedHashSet<>(byUrl.values()));
        }
    }

    public int offeredCount() {
        synchronized (lock) { return offered; }
    }

    public int keptCount() {
        synchronized (lock) { return byUrl.size(); }
    }

    public int droppedCount() {
        synchronized (lock) { return dropped; }
    }

    /** 단발성 병합 헬퍼 */
    public static Set<Candidate> mergeAll(Collection<Candidate> candidates) {
        return new Deduplicator().merge(candidates);
    }
}
