package com.streamscout.core.api;

/** 검증 후 유효 항목이 0개. 이 경우 출력 파일은 쓰지 않는다. */
public class EmptyPlaylistException extends HarvestException {
    private final int discovered;

    public EmptyPlaylistException(int discovered) {
        super("no valid stream links (discovered=" + discovered + ")");
        this.discovered = discovered;
    }

    public int getDiscovered() { return discovered; }
}
