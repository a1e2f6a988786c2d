package com.streamscout.core.search;

import com.streamscout.core.api.FetchException;
import com.streamscout.core.api.ISearchFetcher;
import com.streamscout.core.model.HarvestConfig;
import com.streamscout.core.model.Task;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.nio.charset.StandardCharsets;
import java.util.Objects;

/**
 * 검색 엔드포인트 GET: {baseUrl}?{keyword}=채널&{token}=세션토큰[&{page}=N]
 * page=1이면 page 파라미터를 생략한다.
 */
public class HttpSearchFetcher implements ISearchFetcher {

    /** 테스트/모킹용 송신 훅 */
    @FunctionalInterface
    public interface HttpSender {
        HttpResponse<String> send(HttpRequest req) throws IOException, InterruptedException;
    }

    private final HarvestConfig.Search cfg;
    private final SearchTokenGenerator tokens;
    private final HttpSender sender;

    public HttpSearchFetcher(HarvestConfig.Search cfg) {
        this(cfg, new RandomHashTokenGenerator());
    }

    public HttpSearchFetcher(HarvestConfig.Search cfg, SearchTokenGenerator tokens) {
        this(cfg, tokens, clientSender(cfg));
    }

    /** 테스트용 생성자(송신 훅 주입) */
    public HttpSearchFetcher(HarvestConfig.Search cfg, SearchTokenGenerator tokens, HttpSender sender) {
        this.cfg = Objects.requireNonNull(cfg, "cfg");
        this.tokens = Objects.requireNonNull(tokens, "tokens");
        this.sender = Objects.requireNonNull(sender, "sender");
    }

    private static HttpSender clientSender(HarvestConfig.Search cfg) {
        HttpClient client = HttpClient.newBuilder()
                .followRedirects(HttpClient.Redirect.NORMAL)
                .connectTimeout(cfg.getConnectTimeout())
                .build();
        return req -> client.send(req, HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
    }

    @Override
    public String fetch(Task task) throws FetchException {
        Objects.requireNonNull(task, "task");
        URI uri = buildUri(task);
        HttpRequest req = HttpRequest.newBuilder(uri)
                .timeout(cfg.getTimeout())
                .header("User-Agent", cfg.getUserAgent())
                .header("Accept", "text/html,application/xhtml+xml,application/xml;q=0.9,image/webp,*/*;q=0.8")
                .header("Accept-Language", cfg.getAcceptLanguage())
                .GET()
                .build();
        HttpResponse<String> resp;
        try {
            resp = sender.send(req);
        } catch (HttpTimeoutException e) {
            throw new FetchException(task, "timeout: " + uri, e);
        } catch (IOException e) {
            throw new FetchException(task, "transport error: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new FetchException(task, "interrupted", e);
        }

        int status = resp.statusCode();
        if (status < 200 || status >= 300) {
            throw new FetchException(task, status, "HTTP " + status + " for " + uri);
        }
        return resp.body() == null ? "" : resp.body();
    }

    /** 쿼리 파라미터 조립(값은 UTF-8 URL 인코딩) */
    URI buildUri(Task task) {
        StringBuilder q = new StringBuilder();
        param(q, cfg.getKeywordParam(), task.channel());
        if (cfg.getTokenParam() != null && !cfg.getTokenParam().isBlank()) {
            param(q, cfg.getTokenParam(), tokens.next());
        }
        if (!task.isFirstPage()) {
            param(q, cfg.getPageParam(), Integer.toString(task.page()));
        }
        String base = cfg.getBaseUrl();
        String sep = base.contains("?") ? (base.endsWith("?") || base.endsWith("&") ? "" : "&") : "?";
        return URI.create(base + sep + q);
    }

    private static void param(StringBuilder q, String key, String value) {
        if (q.length() > 0) q.append('&');
        q.append(URLEncoder.encode(key, StandardCharsets.UTF_8))
         .append('=')
         .append(URLEncoder.encode(value, StandardCharsets.UTF_8));
    }
}
