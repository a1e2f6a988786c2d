package com.streamscout.core.extract;

import com.streamscout.core.model.Candidate;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;

import java.util.*;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 세 가지 매칭 전략의 합집합으로 후보를 추출한다(대소문자 무시).
 *  (a) 본문 어디든 있는 절대 URL: http(s)://....m3u8[?query]
 *  (b) 인라인 스크립트 호출: onclick="glshle('....m3u8')"
 *  (c) 특정 클래스 요소의 텍스트: &lt;tba class="ergl"&gt;....m3u8&lt;/tba&gt; (JSoup 셀렉터)
 *
 * 정규화: 스킴 있으면 유지, "//"로 시작하면 "https:" 부착, 그 외(상대 경로)는 버린다.
 */
public class PageLinkExtractor implements LinkExtractor {

    public static final String DEFAULT_EXTENSION = "m3u8";

    private static final Pattern HAS_SCHEME = Pattern.compile("^[a-z][a-z0-9+.\\-]*://", Pattern.CASE_INSENSITIVE);

    private final String extension;
    private final Pattern directUrl;
    private final Pattern scriptCall;

    public PageLinkExtractor() {
        this(DEFAULT_EXTENSION);
    }

    public PageLinkExtractor(String extension) {
        if (extension == null || extension.isBlank()) throw new IllegalArgumentException("extension");
        this.extension = extension.toLowerCase(Locale.ROOT);
        String ext = Pattern.quote(this.extension);
        this.directUrl = Pattern.compile(
                "https?://[^\\s<>\"]+?\\." + ext + "(?:\\?[^\\s<>\"]*)?",
                Pattern.CASE_INSENSITIVE);
        this.scriptCall = Pattern.compile(
                "onclick=\"glshle\\(\\s*'([^']+?\\." + ext + ")'\\s*\\)\"",
                Pattern.CASE_INSENSITIVE);
    }

    @Override
    public Set<Candidate> extract(String pageText, String channel) {
        Objects.requireNonNull(channel, "channel");
        Set<Candidate> out = new LinkedHashSet<>();
        if (pageText == null || pageText.isEmpty()) return out;

        List<String> raw = new ArrayList<>();
        collect(directUrl.matcher(pageText), 0, raw);
        collect(scriptCall.matcher(pageText), 1, raw);
        collectClassedElements(pageText, raw);

        for (String r : raw) {
            String url = normalize(r);
            if (url != null) out.add(new Candidate(url, channel));
        }
        return out;
    }

    /**
     * 스킴 있음 → 유지 / "//" → "https:" 부착 / 그 외 → null(버림)
     */
    public static String normalize(String raw) {
        if (raw == null) return null;
        String s = raw.trim();
        if (s.isEmpty()) return null;
        if (HAS_SCHEME.matcher(s).find()) return s;
        if (s.startsWith("//")) return "https:" + s;
        return null;
    }

    private static void collect(Matcher m, int group, List<String> sink) {
        while (m.find()) {
            String g = m.group(group);
            if (g != null) sink.add(g);
        }
    }

    // (c) tba.ergl 요소 텍스트. 클래스 문자열이 없으면 파싱 자체를 생략
    private void collectClassedElements(String pageText, List<String> sink) {
        if (!pageText.toLowerCase(Locale.ROOT).contains("ergl")) return;

        Document doc = Jsoup.parse(pageText);
        String suffix = "." + extension;
        for (Element el : doc.select("tba.ergl")) {
            String text = el.text();
            if (text.toLowerCase(Locale.ROOT).endsWith(suffix)) sink.add(text);
        }
    }
}
