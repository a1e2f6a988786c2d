package com.streamscout.core.model;

import java.util.Comparator;
import java.util.Objects;

/** 플레이리스트에 기록되는 최종 항목(검증 통과 + 중복 제거 후). */
public record PlaylistEntry(String channel, String url) {

    /** 채널명 오름차순, 같은 채널 안에서는 url 오름차순 */
    public static final Comparator<PlaylistEntry> CHANNEL_ORDER =
            Comparator.comparing(PlaylistEntry::channel).thenComparing(PlaylistEntry::url);

    public PlaylistEntry {
        Objects.requireNonNull(channel, "channel");
        Objects.requireNonNull(url, "url");
    }

    public static PlaylistEntry from(Candidate c) {
        return new PlaylistEntry(c.source(), c.url());
    }
}
