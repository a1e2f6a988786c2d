package com.streamscout.core.model;

import java.util.Objects;
import java.util.Optional;

/**
 * 단일 프로브 결과. 실패도 값으로 표현한다(fail-closed).
 * status -1 = 응답을 받지 못함(타임아웃/전송 오류).
 */
public final class ProbeOutcome {

    public enum Reason {
        /** HEAD content-type에 mpegurl 포함 */
        CONTENT_TYPE_HEAD,
        /** 부분 GET content-type에 mpegurl 포함 */
        CONTENT_TYPE_GET,
        /** 본문 앞부분이 #EXTM3U로 시작 */
        MAGIC_HEADER,
        BAD_STATUS,
        CONTENT_MISMATCH,
        ERROR
    }

    private final String url;
    private final boolean valid;
    private final int status;
    private final String contentType;
    private final Reason reason;
    private final Throwable error;

    private ProbeOutcome(String url, boolean valid, int status, String contentType, Reason reason, Throwable error) {
        this.url = Objects.requireNonNull(url, "url");
        this.valid = valid;
        this.status = status;
        this.contentType = contentType;
        this.reason = Objects.requireNonNull(reason, "reason");
        this.error = error;
    }

    public static ProbeOutcome valid(String url, int status, String contentType, Reason reason) {
        return new ProbeOutcome(url, true, status, contentType, reason, null);
    }

    public static ProbeOutcome invalid(String url, int status, String contentType, Reason reason) {
        return new ProbeOutcome(url, false, status, contentType, reason, null);
    }

    public static ProbeOutcome failed(String url, Throwable error) {
        return new ProbeOutcome(url, false, -1, null, Reason.ERROR, error);
    }

    public String getUrl() { return url; }
    public boolean isValid() { return valid; }
    public int getStatus() { return status; }
    public String getContentType() { return contentType; }
    public Reason getReason() { return reason; }
    public Optional<Throwable> getError() { return Optional.ofNullable(error); }

    @Override
    public String toString() {
        return "ProbeOutcome{url=" + url + ", valid=" + valid + ", status=" + status
                + ", reason=" + reason + (error != null ? ", error=" + error : "") + "}";
    }
}
