package com.streamscout.core.extract;

import com.streamscout.core.model.Candidate;
import org.junit.jupiter.api.Test;

import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

class PageLinkExtractorTest {

    private final PageLinkExtractor m3u8 = new PageLinkExtractor();

    @Test
    void direct_and_script_call_yield_exactly_two_candidates() {
        String page = "<div><a href=\"https://cdn.test/ch1.ext?x=1\">one</a>"
                + "<span onclick=\"glshle('https://cdn.test/ch2.ext')\">two</span></div>";

        Set<Candidate> got = new PageLinkExtractor("ext").extract(page, "X");

        assertThat(got).containsExactlyInAnyOrder(
                new Candidate("https://cdn.test/ch1.ext?x=1", "X"),
                new Candidate("https://cdn.test/ch2.ext", "X"));
    }

    @Test
    void scheme_relative_gets_https_and_relative_path_is_dropped() {
        String page = "<i onclick=\"glshle('//host/a.m3u8')\"></i>"
                + "<i onclick=\"glshle('/live/b.m3u8')\"></i>"
                + "<i onclick=\"glshle('c.m3u8')\"></i>";

        Set<Candidate> got = m3u8.extract(page, "CCTV1");

        assertThat(got).extracting(Candidate::url).containsExactly("https://host/a.m3u8");
    }

    @Test
    void classed_element_text_is_collected() {
        String page = "<table><tr><td><tba class=\"ergl\">http://10.0.0.1:8080/hls/1/index.m3u8</tba></td></tr>"
                + "<tr><td><tba class=\"ergl\">not a stream</tba></td></tr></table>";

        Set<Candidate> got = m3u8.extract(page, "CCTV5");

        assertThat(got).extracting(Candidate::url).contains("http://10.0.0.1:8080/hls/1/index.m3u8");
        assertThat(got).extracting(Candidate::source).containsOnly("CCTV5");
    }

    @Test
    void matching_ignores_case() {
        Set<Candidate> got = m3u8.extract("see HTTPS://CDN.TEST/LIVE/A.M3U8 now", "CCTV2");
        assertThat(got).extracting(Candidate::url).containsExactly("HTTPS://CDN.TEST/LIVE/A.M3U8");
    }

    @Test
    void same_url_from_several_strategies_appears_once() {
        String url = "http://h.test/x.m3u8";
        String page = "<span onclick=\"glshle('" + url + "')\"></span><tba class=\"ergl\">" + url + "</tba>";

        assertEquals(1, m3u8.extract(page, "CCTV1").size());
    }

    @Test
    void extraction_is_idempotent() {
        String page = "a http://a.test/1.m3u8 b <i onclick=\"glshle('//b.test/2.m3u8')\"></i>"
                + "<tba class=\"ergl\">https://c.test/3.m3u8</tba>";

        assertEquals(m3u8.extract(page, "CCTV3"), m3u8.extract(page, "CCTV3"));
    }

    @Test
    void empty_or_unrelated_text_is_not_an_error() {
        assertTrue(m3u8.extract("", "CCTV1").isEmpty());
        assertTrue(m3u8.extract(null, "CCTV1").isEmpty());
        assertTrue(m3u8.extract("<html><body>nothing here http://a.test/video.mp4</body></html>", "CCTV1").isEmpty());
    }

    @Test
    void normalize_rules() {
        assertEquals("http://a/b.m3u8", PageLinkExtractor.normalize(" http://a/b.m3u8 "));
        assertEquals("https://a/b.m3u8", PageLinkExtractor.normalize("//a/b.m3u8"));
        assertNull(PageLinkExtractor.normalize("a/b.m3u8"));
        assertNull(PageLinkExtractor.normalize("/b.m3u8"));
        assertNull(PageLinkExtractor.normalize("   "));
        assertNull(PageLinkExtractor.normalize(null));
    }

    @Test
    void extension_must_be_given() {
        assertThrows(IllegalArgumentException.class, () -> new PageLinkExtractor(" "));
    }
}
