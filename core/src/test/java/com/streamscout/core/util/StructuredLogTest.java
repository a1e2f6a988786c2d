package com.streamscout.core.util;

import com.streamscout.core.util.StructuredLog.Event;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.logging.Level;

import static org.assertj.core.api.Assertions.assertThat;

class StructuredLogTest {

    private final StructuredLog slog = StructuredLog.get(StructuredLogTest.class);

    @Test
    void event_is_one_json_line_with_typed_values() {
        String json = slog.event(Event.PAGE_FETCHED)
                .channel("CCTV1").page(2).count("links", 7).flag("exhausted", false)
                .toJson();

        assertThat(json).startsWith("{").endsWith("}").doesNotContain("\n");
        assertThat(json).contains("\"event\":\"page-fetched\"", "\"lvl\":\"INFO\"", "\"comp\":\"StructuredLogTest\"",
                "\"channel\":\"CCTV1\"", "\"page\":2", "\"links\":7", "\"exhausted\":false");
    }

    @Test
    void strings_are_escaped_and_errors_summarized() {
        String json = slog.event(Event.FETCH_FAILED)
                .url("http://a/\tb")
                .error(new IOException("bad \"gateway\"\n"))
                .toJson();

        assertThat(json).contains("\"lvl\":\"WARNING\"",
                "\"url\":\"http://a/\\tb\"",
                "\"error\":\"IOException\"",
                "\"message\":\"bad \\\"gateway\\\"\\n\"");
    }

    @Test
    void level_override_and_null_values() {
        String json = slog.event(Event.HARVEST_DONE)
                .at(Level.WARNING)
                .count("valid", 0)
                .with("file", null)
                .error(new IllegalStateException())
                .toJson();

        assertThat(json).contains("\"event\":\"harvest-done\"", "\"lvl\":\"WARNING\"",
                "\"valid\":0", "\"file\":null", "\"message\":null");
    }

    @Test
    void wire_names_are_stable() {
        assertThat(Event.PROBE_DONE.wire()).isEqualTo("probe-done");
        assertThat(Event.PROBE_DONE.level()).isEqualTo(Level.FINE);
        assertThat(StructuredLog.quote("a\u0001")).isEqualTo("\"a\\u0001\"");
    }
}
