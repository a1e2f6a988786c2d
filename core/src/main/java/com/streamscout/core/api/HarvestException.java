package com.streamscout.core.api;

/** 실행 단위(run-level) 실패. 하위 단계 오류는 여기까지 올라오지 않는다. */
public class HarvestException extends RuntimeException {
    public HarvestException(String message) { super(message); }
    public HarvestException(String message, Throwable cause) { super(message, cause); }
}
