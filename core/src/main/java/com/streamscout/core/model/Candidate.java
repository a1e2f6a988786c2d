package com.streamscout.core.model;

import java.util.Objects;

/**
 * 추출된 후보 링크.
 * url은 절대 URL(정규화 완료), source는 링크를 발견한 채널명.
 */
public record Candidate(String url, String source) {
    public Candidate {
        Objects.requireNonNull(url, "url");
        Objects.requireNonNull(source, "source");
    }
}
