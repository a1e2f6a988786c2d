package com.streamscout.core.service;

import com.streamscout.core.api.EmptyPlaylistException;
import com.streamscout.core.api.ISearchFetcher;
import com.streamscout.core.api.IStreamProbe;
import com.streamscout.core.extract.PageLinkExtractor;
import com.streamscout.core.model.*;
import com.streamscout.core.model.ProbeOutcome.Reason;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArraySet;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

class HarvestServiceTest {

    @TempDir
    Path out;

    private HarvestConfig config(List<String> channels, int pages) {
        HarvestConfig cfg = HarvestConfig.defaults().setChannels(channels);
        cfg.search().setPages(pages);
        cfg.output().setDir(out);
        return cfg;
    }

    private static String link(String url) {
        return "<span onclick=\"glshle('" + url + "')\">" + url + "</span>";
    }

    /** url에 "bad"가 들어가면 무효 */
    private static IStreamProbe probe(Map<String, AtomicInteger> calls) {
        return url -> {
            calls.computeIfAbsent(url, k -> new AtomicInteger()).incrementAndGet();
            return url.contains("bad")
                    ? ProbeOutcome.invalid(url, 404, "text/html", Reason.BAD_STATUS)
                    : ProbeOutcome.valid(url, 200, "application/vnd.apple.mpegurl", Reason.CONTENT_TYPE_HEAD);
        };
    }

    @Test
    void end_to_end_writes_sorted_valid_entries() throws Exception {
        ISearchFetcher fetcher = t -> t.page() == 1
                ? link("http://h.test/" + t.channel() + "/ok.m3u8") + link("http://h.test/" + t.channel() + "/bad.m3u8")
                : "";
        Map<String, AtomicInteger> calls = new ConcurrentHashMap<>();

        HarvestConfig cfg = config(List.of("Z", "A", "M"), 3);
        cfg.search().setPageConcurrency(1);
        HarvestService svc = new HarvestService(cfg,
                fetcher, new PageLinkExtractor(), probe(calls), d -> {});
        RunOutcome o = svc.run();

        assertEquals(6, o.getDiscovered());
        assertEquals(6, o.getUnique());
        assertEquals(3, o.getValidated());
        assertEquals(out.resolve("ysws.m3u"), o.getOutputFile());
        assertEquals(new RunOutcome.ChannelCount(2, 1), o.getPerChannel().get("A"));
        assertThat(o.getPerChannel().keySet()).containsExactly("A", "M", "Z");
        // 두 번째 페이지가 비어 세 번째는 건너뜀
        assertEquals(3, o.getStats().pagesSkipped);

        List<String> lines = Files.readAllLines(o.getOutputFile(), StandardCharsets.UTF_8);
        assertThat(lines).containsExactly(
                "#EXTM3U",
                "#EXTINF:-1 tvg-id=\"\" tvg-name=\"A\" tvg-logo=\"\" group-title=\"CCTV\",A",
                "http://h.test/A/ok.m3u8",
                "#EXTINF:-1 tvg-id=\"\" tvg-name=\"M\" tvg-logo=\"\" group-title=\"CCTV\",M",
                "http://h.test/M/ok.m3u8",
                "#EXTINF:-1 tvg-id=\"\" tvg-name=\"Z\" tvg-logo=\"\" group-title=\"CCTV\",Z",
                "http://h.test/Z/ok.m3u8");
    }

    @Test
    void shared_url_keeps_first_channel_and_is_probed_once() {
        ISearchFetcher fetcher = t -> link("http://shared.test/live.m3u8");
        Map<String, AtomicInteger> calls = new ConcurrentHashMap<>();
        HarvestConfig cfg = config(List.of("B", "A"), 1);
        // 채널을 순서대로 하나씩 처리해서 발견 순서를 고정
        cfg.search().setChannelConcurrency(1).setPageConcurrency(1);

        RunOutcome o = new HarvestService(cfg, fetcher, new PageLinkExtractor(), probe(calls), d -> {}).run();

        assertEquals(2, o.getDiscovered());
        assertEquals(1, o.getUnique());
        assertThat(o.getEntries()).containsExactly(new PlaylistEntry("B", "http://shared.test/live.m3u8"));
        assertEquals(1, calls.get("http://shared.test/live.m3u8").get());
        assertEquals(new RunOutcome.ChannelCount(1, 0), o.getPerChannel().get("A"));
    }

    @Test
    void no_valid_links_throws_and_leaves_existing_file_untouched() throws Exception {
        Path existing = out.resolve("ysws.m3u");
        Files.writeString(existing, "#EXTM3U\nprevious\n");
        ISearchFetcher fetcher = t -> link("http://h.test/" + t.channel() + "/bad.m3u8");

        HarvestService svc = new HarvestService(config(List.of("CCTV1", "CCTV2"), 1),
                fetcher, new PageLinkExtractor(), probe(new ConcurrentHashMap<>()), d -> {});

        EmptyPlaylistException e = assertThrows(EmptyPlaylistException.class, svc::run);
        assertEquals(2, e.getDiscovered());
        assertEquals("#EXTM3U\nprevious\n", Files.readString(existing));
    }

    @Test
    void nothing_discovered_writes_no_file() {
        HarvestService svc = new HarvestService(config(List.of("CCTV1"), 2),
                t -> "<html></html>", new PageLinkExtractor(), probe(new ConcurrentHashMap<>()), d -> {});

        assertThrows(EmptyPlaylistException.class, svc::run);
        assertFalse(Files.exists(out.resolve("ysws.m3u")));
    }

    @Test
    void progress_reports_every_phase() {
        Set<String> phases = new CopyOnWriteArraySet<>();
        ISearchFetcher fetcher = t -> link("http://h.test/" + t.channel() + ".m3u8");

        new HarvestService(config(List.of("CCTV1"), 1), fetcher, new PageLinkExtractor(),
                probe(new ConcurrentHashMap<>()), d -> {})
                .run((p, phase, done, total) -> phases.add(phase));

        assertThat(phases).contains("search", "validate", "export");
    }

    @Test
    void invalid_config_is_rejected_at_construction() {
        HarvestConfig cfg = config(List.of("CCTV1"), 1);
        cfg.search().setPages(0);
        assertThrows(IllegalArgumentException.class, () -> new HarvestService(cfg,
                t -> "", new PageLinkExtractor(), url -> ProbeOutcome.failed(url, new RuntimeException()), d -> {}));
    }
}
