package com.streamscout.app.cli;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.streamscout.app.report.RunReport;
import com.streamscout.app.report.RunReportWriter;
import com.streamscout.core.api.ISearchFetcher;
import com.streamscout.core.extract.PageLinkExtractor;
import com.streamscout.core.model.HarvestConfig;
import com.streamscout.core.model.ProbeOutcome;
import com.streamscout.core.service.HarvestService;
import org.apache.commons.cli.CommandLine;
import org.apache.commons.cli.DefaultParser;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

class MainTest {

    @TempDir
    Path tmp;

    private static CommandLine parse(String... args) throws Exception {
        return new DefaultParser().parse(Main.buildOptions(), args);
    }

    /** 네트워크 없는 서비스: 채널마다 링크 하나, "bad"가 들어간 url만 무효 */
    private static Main offlineMain(String urlPart) {
        return new Main(cfg -> {
            ISearchFetcher fetcher = t -> "<i onclick=\"glshle('http://h.test/" + t.channel() + "/" + urlPart + ".m3u8')\"></i>";
            return new HarvestService(cfg, fetcher, new PageLinkExtractor(),
                    url -> url.contains("bad")
                            ? ProbeOutcome.invalid(url, 404, null, ProbeOutcome.Reason.BAD_STATUS)
                            : ProbeOutcome.valid(url, 200, "application/x-mpegurl", ProbeOutcome.Reason.CONTENT_TYPE_HEAD),
                    d -> {});
        }, false);
    }

    @Test
    void options_override_yaml_values() throws Exception {
        Path yml = tmp.resolve("harvest.yml");
        Files.writeString(yml, "channels: [CCTV9]\nsearch:\n  pages: 2\n  pacingMs: 100\noutput:\n  file: from-yaml.m3u\n");

        HarvestConfig cfg = Main.resolveConfig(parse(
                "--config", yml.toString(),
                "--channels", "CCTV1,CCTV2",
                "--pages", "4",
                "--pacing-ms", "8000",
                "--out", tmp.toString(),
                "--group", "TV",
                "--no-early-stop",
                "--report"));

        assertEquals(List.of("CCTV1", "CCTV2"), cfg.getChannels());
        assertEquals(4, cfg.search().getPages());
        assertEquals(Duration.ofSeconds(8), cfg.search().getPacing());
        assertFalse(cfg.search().isEarlyStop());
        assertEquals(tmp.resolve("from-yaml.m3u"), cfg.output().resolvePlaylistPath());
        assertEquals("TV", cfg.output().getGroupTitle());
        assertTrue(cfg.output().isReport());
    }

    @Test
    void bad_arguments_exit_with_usage_code() throws Exception {
        Main main = offlineMain("ok");
        assertEquals(Main.EXIT_USAGE, main.run(new String[]{"--bogus"}, Map.of()));
        assertEquals(Main.EXIT_USAGE, main.run(new String[]{"--pages", "many"}, Map.of()));
        assertEquals(Main.EXIT_USAGE, main.run(new String[]{"--pages", "0"}, Map.of()));
        assertEquals(Main.EXIT_USAGE, main.run(new String[]{"--config", tmp.resolve("missing.yml").toString()}, Map.of()));

        Path malformed = tmp.resolve("bad.yml");
        Files.writeString(malformed, "search: [unclosed\n");
        assertEquals(Main.EXIT_USAGE, main.run(new String[]{"--config", malformed.toString()}, Map.of()));
    }

    @Test
    void help_exits_zero() {
        assertEquals(Main.EXIT_OK, offlineMain("ok").run(new String[]{"--help"}, Map.of()));
    }

    @Test
    void successful_run_writes_playlist_report_and_step_outputs() throws Exception {
        Path gh = tmp.resolve("gh_output");
        Map<String, String> env = Map.of("GITHUB_ACTIONS", "true", "GITHUB_OUTPUT", gh.toString());

        int code = offlineMain("ok").run(new String[]{
                "--channels", "CCTV2,CCTV1", "--pages", "1", "--out", tmp.toString(), "--report"}, env);

        assertEquals(Main.EXIT_OK, code);
        Path playlist = tmp.resolve("ysws.m3u");
        assertThat(Files.readAllLines(playlist)).contains("http://h.test/CCTV1/ok.m3u8", "http://h.test/CCTV2/ok.m3u8");

        RunReport report = new ObjectMapper().registerModule(new JavaTimeModule())
                .readValue(RunReportWriter.reportPathFor(playlist).toFile(), RunReport.class);
        assertEquals(2, report.valid);
        assertThat(report.channels).containsOnlyKeys("CCTV1", "CCTV2");

        assertThat(Files.readAllLines(gh)).containsExactly(
                "output_file=" + playlist,
                "total_links=2",
                "valid_links=2");
    }

    @Test
    void empty_result_exits_one_without_output() {
        int code = offlineMain("bad").run(new String[]{"--channels", "CCTV1", "--pages", "1", "--out", tmp.toString()}, Map.of());

        assertEquals(Main.EXIT_FAILED, code);
        assertFalse(Files.exists(tmp.resolve("ysws.m3u")));
    }
}
