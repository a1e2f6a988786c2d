package com.streamscout.core.util;

import java.util.concurrent.*;

/** 고정 스레드풀 + 유한 큐(가득 차면 제출자가 대기 = 역압). */
public final class BoundedExecutors {
    private BoundedExecutors() {}

    public static ExecutorService newBlocking(int threads, int queueCapacity, String threadPrefix) {
        int n = Math.max(1, threads);
        return new ThreadPoolExecutor(
                n, n,
                0L, TimeUnit.MILLISECONDS,
                new LinkedBlockingQueue<>(Math.max(1, queueCapacity)),
                new NamedThreadFactory(threadPrefix),
                (r, e) -> {
                    if (e.isShutdown()) throw new RejectedExecutionException("executor shut down");
                    try { e.getQueue().put(r); }
                    catch (InterruptedException ie) {
                        Thread.currentThread().interrupt();
                        throw new RejectedExecutionException("Interrupted while enqueueing", ie);
                    }
                }
        );
    }

    /** shutdownNow + 제한 시간 대기 */
    public static void shutdown(ExecutorService exec, long awaitSeconds) {
        if (exec == null) return;
        exec.shutdownNow();
        try {
            exec.awaitTermination(awaitSeconds, TimeUnit.SECONDS);
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
        }
    }
}
