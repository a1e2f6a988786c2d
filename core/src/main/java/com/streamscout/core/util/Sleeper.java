package com.streamscout.core.util;

import java.time.Duration;

/** 대기 추상화(테스트에서 실제 sleep 없이 기록만 하도록 교체). */
@FunctionalInterface
public interface Sleeper {
    void sleep(Duration d) throws InterruptedException;
}
