package com.streamscout.core.api;

import com.streamscout.core.model.Task;

/** 검색 페이지 fetch 실패. status -1 = 응답 없음(타임아웃/전송 오류). */
public class FetchException extends Exception {
    private final transient Task task;
    private final int status;

    public FetchException(Task task, int status, String message) {
        super(message);
        this.task = task;
        this.status = status;
    }

    public FetchException(Task task, String message, Throwable cause) {
        super(message, cause);
        this.task = task;
        this.status = -1;
    }

    public Task getTask() { return task; }
    public int getStatus() { return status; }
}
