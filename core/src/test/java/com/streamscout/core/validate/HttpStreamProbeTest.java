package com.streamscout.core.validate;

import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import com.streamscout.core.model.HarvestConfig;
import com.streamscout.core.model.ProbeOutcome;
import com.streamscout.core.model.ProbeOutcome.Reason;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.ServerSocket;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

class HttpStreamProbeTest {

    static HttpServer s;
    static ExecutorService exec;
    static String base;
    static final AtomicReference<String> lastRange = new AtomicReference<>();

    @BeforeAll
    static void up() throws Exception {
        s = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        base = "http://127.0.0.1:" + s.getAddress().getPort();

        s.createContext("/missing.m3u8", ex -> respond(ex, 404, "text/plain", "nope"));

        s.createContext("/page.m3u8", ex ->
                respond(ex, 200, "text/html; charset=utf-8", "<html><body>blocked</body></html>"));

        // HEAD만으로 판정되는 정상 스트림
        s.createContext("/live.m3u8", ex ->
                respond(ex, 200, "application/vnd.apple.mpegurl", "#EXTM3U\n#EXT-X-VERSION:3\n"));

        // HEAD 미지원 + content-type 불명확 → Range GET 본문으로 판정
        s.createContext("/nohead.m3u8", ex -> {
            if ("HEAD".equals(ex.getRequestMethod())) {
                respond(ex, 405, "text/plain", "");
                return;
            }
            lastRange.set(ex.getRequestHeaders().getFirst("Range"));
            respond(ex, 206, "application/octet-stream", "#EXTM3U\n#EXT-X-TARGETDURATION:10\n");
        });

        s.createContext("/bom.m3u8", ex ->
                respond(ex, 200, "text/plain", "\uFEFF\n  #EXTM3U\n#EXTINF:-1,x\nseg.ts\n"));

        s.createContext("/slow.m3u8", ex -> {
            try {
                Thread.sleep(2_000);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            respond(ex, 200, "application/x-mpegurl", "#EXTM3U\n");
        });

        exec = Executors.newCachedThreadPool();
        s.setExecutor(exec);
        s.start();
    }

    @AfterAll
    static void down() {
        if (s != null) s.stop(0);
        if (exec != null) exec.shutdownNow();
    }

    private static void respond(HttpExchange ex, int status, String contentType, String body) throws IOException {
        byte[] bytes = body.getBytes(StandardCharsets.UTF_8);
        ex.getResponseHeaders().add("Content-Type", contentType);
        boolean noBody = "HEAD".equals(ex.getRequestMethod()) || bytes.length == 0;
        ex.sendResponseHeaders(status, noBody ? -1 : bytes.length);
        if (!noBody) {
            try (OutputStream os = ex.getResponseBody()) {
                os.write(bytes);
            }
        }
        ex.close();
    }

    private static HttpStreamProbe probe(Duration timeout) {
        HarvestConfig.Validate cfg = new HarvestConfig.Validate()
                .setConnectTimeout(Duration.ofSeconds(1))
                .setTimeout(timeout);
        return new HttpStreamProbe(cfg, "streamscout-test");
    }

    private final HttpStreamProbe probe = probe(Duration.ofSeconds(3));

    @Test
    void status_404_is_invalid() {
        ProbeOutcome o = probe.probe(base + "/missing.m3u8");
        assertFalse(o.isValid());
        assertEquals(404, o.getStatus());
        assertEquals(Reason.BAD_STATUS, o.getReason());
    }

    @Test
    void html_body_without_magic_header_is_invalid() {
        ProbeOutcome o = probe.probe(base + "/page.m3u8");
        assertFalse(o.isValid());
        assertEquals(200, o.getStatus());
        assertEquals(Reason.CONTENT_MISMATCH, o.getReason());
    }

    @Test
    void playlist_content_type_on_head_is_valid() {
        ProbeOutcome o = probe.probe(base + "/live.m3u8");
        assertTrue(o.isValid());
        assertEquals(Reason.CONTENT_TYPE_HEAD, o.getReason());
    }

    @Test
    void head_not_allowed_falls_back_to_ranged_get() {
        ProbeOutcome o = probe.probe(base + "/nohead.m3u8");
        assertTrue(o.isValid());
        assertEquals(206, o.getStatus());
        assertEquals(Reason.MAGIC_HEADER, o.getReason());
        assertEquals("bytes=0-511", lastRange.get());
    }

    @Test
    void bom_and_leading_whitespace_before_magic_header_are_tolerated() {
        ProbeOutcome o = probe.probe(base + "/bom.m3u8");
        assertTrue(o.isValid());
        assertEquals(Reason.MAGIC_HEADER, o.getReason());
    }

    @Test
    void timeout_is_invalid_with_error() {
        ProbeOutcome o = probe(Duration.ofMillis(300)).probe(base + "/slow.m3u8");
        assertFalse(o.isValid());
        assertEquals(Reason.ERROR, o.getReason());
        assertTrue(o.getError().isPresent());
    }

    @Test
    void refused_connection_and_bad_scheme_are_invalid() throws IOException {
        int closedPort;
        try (ServerSocket ss = new ServerSocket(0)) {
            closedPort = ss.getLocalPort();
        }
        ProbeOutcome refused = probe.probe("http://127.0.0.1:" + closedPort + "/x.m3u8");
        assertFalse(refused.isValid());
        assertEquals(-1, refused.getStatus());

        ProbeOutcome ftp = probe.probe("ftp://127.0.0.1/x.m3u8");
        assertFalse(ftp.isValid());
        assertEquals(Reason.ERROR, ftp.getReason());
    }

    @Test
    void magic_header_helpers() {
        assertTrue(HttpStreamProbe.startsWithMagic("#EXTM3U\n"));
        assertTrue(HttpStreamProbe.startsWithMagic("\uFEFF#EXTM3U"));
        assertTrue(HttpStreamProbe.startsWithMagic("\r\n #EXTM3U"));
        assertFalse(HttpStreamProbe.startsWithMagic("<html>#EXTM3U"));
        assertFalse(HttpStreamProbe.startsWithMagic(null));

        assertTrue(HttpStreamProbe.isPlaylistType("Application/X-MpegURL"));
        assertFalse(HttpStreamProbe.isPlaylistType("video/mp2t"));
        assertFalse(HttpStreamProbe.isPlaylistType(null));
    }

    @Test
    void leading_read_is_capped() throws IOException {
        byte[] big = new byte[10_000];
        java.util.Arrays.fill(big, (byte) 'a');
        String lead = HttpStreamProbe.readLeading(new ByteArrayInputStream(big), 512);
        assertThat(lead).hasSize(512);
    }
}
