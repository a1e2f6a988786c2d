package com.streamscout.core.model;

import java.util.Objects;

/** 검색 작업 단위: (채널, 페이지). 페이지는 1부터 시작. */
public record Task(String channel, int page) {
    public Task {
        Objects.requireNonNull(channel, "channel");
        if (page < 1) throw new IllegalArgumentException("page must be >= 1");
    }

    public boolean isFirstPage() { return page == 1; }
}
