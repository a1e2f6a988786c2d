package com.streamscout.core.validate;

import com.streamscout.core.api.IStreamProbe;
import com.streamscout.core.model.HarvestConfig;
import com.streamscout.core.model.ProbeOutcome;
import com.streamscout.core.model.ProbeOutcome.Reason;

import java.io.IOException;
import java.io.InputStream;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Locale;
import java.util.Objects;

/**
 * 스트림 플레이리스트 확인 프로브.
 *  1) HEAD: 2xx + content-type에 "mpegurl" → 유효
 *  2) 불확실하면 Range GET(앞 probeBytes 바이트만): 2xx + (content-type "mpegurl" 또는 본문이 #EXTM3U로 시작) → 유효
 *  3) 그 외 상태코드/예외/타임아웃 → 무효(fail-closed)
 * 전체 본문은 절대 내려받지 않는다.
 */
public class HttpStreamProbe implements IStreamProbe {

    public static final String MEDIA_TYPE_MARKER = "mpegurl";
    public static final String MAGIC_HEADER = "#EXTM3U";

    /** 테스트/모킹용 송신 훅. 응답 본문은 스트림으로 받고 호출자가 닫는다. */
    @FunctionalInterface
    public interface HttpSender {
        HttpResponse<InputStream> send(HttpRequest req) throws IOException, InterruptedException;
    }

    private final HttpSender sender;
    private final Duration timeout;
    private final int probeBytes;
    private final boolean headFirst;
    private final String userAgent;

    public HttpStreamProbe(HarvestConfig.Validate cfg, String userAgent) {
        this(cfg, userAgent, clientSender(cfg));
    }

    /** 테스트용 생성자(송신 훅 주입) */
    public HttpStreamProbe(HarvestConfig.Validate cfg, String userAgent, HttpSender sender) {
        Objects.requireNonNull(cfg, "cfg");
        this.sender = Objects.requireNonNull(sender, "sender");
        this.timeout = cfg.getTimeout();
        this.probeBytes = cfg.getProbeBytes();
        this.headFirst = cfg.isHeadFirst();
        this.userAgent = userAgent;
    }

    private static HttpSender clientSender(HarvestConfig.Validate cfg) {
        HttpClient client = HttpClient.newBuilder()
                .followRedirects(HttpClient.Redirect.NORMAL)
                .connectTimeout(cfg.getConnectTimeout())
                .build();
        return req -> client.send(req, HttpResponse.BodyHandlers.ofInputStream());
    }

    @Override
    public ProbeOutcome probe(String url) {
        Objects.requireNonNull(url, "url");
        try {
            URI uri = URI.create(url);

            if (headFirst) {
                HttpResponse<InputStream> head = sender.send(request(uri).method("HEAD", HttpRequest.BodyPublishers.noBody()).build());
                closeQuietly(head.body());
                String ct = contentType(head);
                if (isSuccess(head.statusCode()) && isPlaylistType(ct)) {
                    return ProbeOutcome.valid(url, head.statusCode(), ct, Reason.CONTENT_TYPE_HEAD);
                }
                // HEAD 미지원(405 등)이거나 content-type 불명확 → Range GET으로 폴백
            }

            HttpRequest get = request(uri)
                    .header("Range", "bytes=0-" + (probeBytes - 1))
                    .GET()
                    .build();
            HttpResponse<InputStream> resp = sender.send(get);
            int status = resp.statusCode();
            String ct = contentType(resp);
            try (InputStream body = resp.body()) {
                if (!isSuccess(status)) {
                    return ProbeOutcome.invalid(url, status, ct, Reason.BAD_STATUS);
                }
                if (isPlaylistType(ct)) {
                    return ProbeOutcome.valid(url, status, ct, Reason.CONTENT_TYPE_GET);
                }
                String lead = readLeading(body, probeBytes);
                if (startsWithMagic(lead)) {
                    return ProbeOutcome.valid(url, status, ct, Reason.MAGIC_HEADER);
                }
                return ProbeOutcome.invalid(url, status, ct, Reason.CONTENT_MISMATCH);
            }
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            return ProbeOutcome.failed(url, ie);
        } catch (IOException | RuntimeException e) {
            // 타임아웃/전송 오류/잘못된 URI/지원하지 않는 스킴 모두 무효
            return ProbeOutcome.failed(url, e);
        }
    }

    private HttpRequest.Builder request(URI uri) {
        HttpRequest.Builder b = HttpRequest.newBuilder(uri).timeout(timeout);
        if (userAgent != null && !userAgent.isBlank()) b.header("User-Agent", userAgent);
        return b;
    }

    static boolean isSuccess(int status) {
        return status >= 200 && status < 300;
    }

    static boolean isPlaylistType(String contentType) {
        return contentType != null && contentType.toLowerCase(Locale.ROOT).contains(MEDIA_TYPE_MARKER);
    }

    /** BOM/앞쪽 공백을 건너뛰고 #EXTM3U로 시작하는지 */
    static boolean startsWithMagic(String lead) {
        if (lead == null) return false;
        int i = 0;
        if (!lead.isEmpty() && lead.charAt(0) == '\uFEFF') i = 1;
        while (i < lead.length() && Character.isWhitespace(lead.charAt(i))) i++;
        return lead.startsWith(MAGIC_HEADER, i);
    }

    /** 최대 limit 바이트까지만 읽는다(Range 무시하는 서버 대비). */
    static String readLeading(InputStream in, int limit) throws IOException {
        if (in == null) return "";
        byte[] buf = in.readNBytes(limit);
        return new String(buf, StandardCharsets.UTF_8);
    }

    private static String contentType(HttpResponse<?> r) {
        return r.headers().firstValue("Content-Type").orElse(null);
    }

    private static void closeQuietly(InputStream in) {
        if (in == null) return;
        try { in.close(); } catch (IOException ignore) { /* HEAD 본문은 비어 있음 */ }
    }
}
