package com.streamscout.core.util;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * 수집 파이프라인 이벤트를 JSON 한 줄로 남기는 로거(JUL 위).
 * <pre>
 * SLOG.event(Event.PAGE_FETCHED).channel("CCTV1").page(2).count("links", 7).log();
 * </pre>
 * 이벤트 이름과 기본 레벨은 {@link Event}가 정한다.
 */
public final class StructuredLog {

    /** 파이프라인 단계별 이벤트. wire 이름은 로그 수집기 쪽 키. */
    public enum Event {
        HARVEST_START("harvest-start", Level.INFO),
        PAGE_FETCHED("page-fetched", Level.INFO),
        FETCH_FAILED("fetch-failed", Level.WARNING),
        CHANNEL_EXHAUSTED("channel-exhausted", Level.INFO),
        CHANNEL_FAILED("channel-failed", Level.WARNING),
        PROBE_DONE("probe-done", Level.FINE),
        HARVEST_DONE("harvest-done", Level.INFO);

        private final String wire;
        private final Level level;

        Event(String wire, Level level) {
            this.wire = wire;
            this.level = level;
        }

        public String wire() { return wire; }

        public Level level() { return level; }
    }

    private final Logger jul;
    private final String component;

    private StructuredLog(Class<?> owner) {
        this.jul = Logger.getLogger(owner.getName());
        this.component = owner.getSimpleName();
    }

    public static StructuredLog get(Class<?> owner) {
        return new StructuredLog(owner);
    }

    public Entry event(Event event) {
        return new Entry(Objects.requireNonNull(event, "event"));
    }

    /** 이벤트 한 건. log() 호출 전까지는 아무것도 출력하지 않는다. */
    public final class Entry {
        private final Event event;
        private Level level;
        private Throwable error;
        // 삽입 순서 유지, 값은 이미 JSON 조각으로 변환된 상태
        private final List<String[]> fields = new ArrayList<>();

        private Entry(Event event) {
            this.event = event;
            this.level = event.level();
        }

        public Entry channel(String channel) { return with("channel", channel); }

        public Entry page(int page) { return count("page", page); }

        public Entry url(String url) { return with("url", url); }

        public Entry status(int status) { return count("status", status); }

        public Entry millis(long ms) { return count("ms", ms); }

        public Entry count(String key, long n) {
            fields.add(new String[]{key, Long.toString(n)});
            return this;
        }

        public Entry flag(String key, boolean b) {
            fields.add(new String[]{key, Boolean.toString(b)});
            return this;
        }

        public Entry with(String key, String value) {
            fields.add(new String[]{key, value == null ? "null" : quote(value)});
            return this;
        }

        public Entry error(Throwable t) {
            this.error = t;
            return this;
        }

        /** 이벤트 기본 레벨 대신 사용 (예: 결과 0건인 harvest-done은 WARNING) */
        public Entry at(Level level) {
            this.level = Objects.requireNonNull(level, "level");
            return this;
        }

        public void log() {
            if (!jul.isLoggable(level)) return;
            // 스택은 slf4j 쪽 로그가 담당, 여기서는 한 줄만
            jul.log(level, toJson());
        }

        String toJson() {
            StringBuilder sb = new StringBuilder(160).append('{');
            sb.append("\"ts\":").append(quote(Instant.now().toString()));
            sb.append(",\"lvl\":").append(quote(level.getName()));
            sb.append(",\"comp\":").append(quote(component));
            sb.append(",\"thread\":").append(quote(Thread.currentThread().getName()));
            sb.append(",\"event\":").append(quote(event.wire()));
            for (String[] f : fields) {
                sb.append(',').append(quote(f[0])).append(':').append(f[1]);
            }
            if (error != null) {
                sb.append(",\"error\":").append(quote(error.getClass().getSimpleName()));
                String msg = error.getMessage();
                sb.append(",\"message\":").append(msg == null ? "null" : quote(msg));
            }
            return sb.append('}').toString();
        }
    }

    static String quote(String s) {
        StringBuilder r = new StringBuilder(s.length() + 2).append('"');
        s.chars().forEach(c -> {
            if (c == '"' || c == '\\') {
                r.append('\\').append((char) c);
            } else if (c == '\n') {
                r.append("\\n");
            } else if (c == '\r') {
                r.append("\\r");
            } else if (c == '\t') {
                r.append("\\t");
            } else if (c < 0x20) {
                r.append(String.format("\\u%04x", c));
            } else {
                r.append((char) c);
            }
        });
        return r.append('"').toString();
    }
}
