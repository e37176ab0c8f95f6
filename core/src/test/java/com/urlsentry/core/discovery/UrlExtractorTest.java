package com.urlsentry.core.discovery;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class UrlExtractorTest {

    private final UrlExtractor ex = new UrlExtractor();

    @Nested
    @DisplayName("사전 필터")
    class Prefilter {
        @Test
        void rejects_lines_without_http() {
            assertThat(ex.mayContainUrl("just some prose, no links here")).isFalse();
            assertThat(ex.mayContainUrl("")).isFalse();
            assertThat(ex.mayContainUrl(null)).isFalse();
        }

        @Test
        void accepts_http_in_any_case() {
            assertThat(ex.mayContainUrl("see HTTPS://EXAMPLE.COM")).isTrue();
            assertThat(ex.mayContainUrl("see http://a.b")).isTrue();
        }

        @Test
        void prefilter_pass_does_not_imply_a_match() {
            assertThat(ex.mayContainUrl("the http protocol is old")).isTrue();
            assertThat(ex.extract("the http protocol is old")).isEmpty();
        }
    }

    @Nested
    @DisplayName("마크다운/HTML")
    class Markup {
        @Test
        void inline_link() {
            assertThat(ex.extract("[docs](https://example.com/docs)"))
                    .containsExactly("https://example.com/docs");
        }

        @Test
        void inline_link_without_path() {
            assertThat(ex.extract("[x](http://foo.bar)")).containsExactly("http://foo.bar");
        }

        @Test
        void image_and_reference_links() {
            assertThat(ex.extract("![logo](https://img.test/logo.png)")).containsExactly("https://img.test/logo.png");
            assertThat(ex.extract("[ref]: http://foo.bar/page")).containsExactly("http://foo.bar/page");
        }

        @Test
        void html_attribute_stops_at_quote() {
            assertThat(ex.extract("<a href=\"https://a.test/x?y=1\">x</a>"))
                    .containsExactly("https://a.test/x?y=1");
        }

        @Test
        void badge_line_yields_every_url_in_order() {
            String line = "[![ci](https://ci.test/badge.svg)](https://ci.test/build) and https://ci.test/build";
            assertThat(ex.extract(line)).containsExactly(
                    "https://ci.test/badge.svg", "https://ci.test/build", "https://ci.test/build");
        }
    }

    @Nested
    @DisplayName("꼬리 문장부호")
    class Trailing {
        @Test
        void sentence_punctuation_is_trimmed() {
            assertThat(ex.extract("Go to https://a.test/ok.")).containsExactly("https://a.test/ok");
            assertThat(ex.extract("Visit https://a.test/ok, then")).containsExactly("https://a.test/ok");
            assertThat(ex.extract("Really? https://a.test/q?!")).containsExactly("https://a.test/q");
        }

        @Test
        void balanced_parentheses_are_kept() {
            assertThat(ex.extract("(see https://en.wikipedia.org/wiki/Rust_(programming_language))"))
                    .containsExactly("https://en.wikipedia.org/wiki/Rust_(programming_language)");
        }

        @Test
        void query_and_fragment_survive() {
            assertThat(ex.extract("https://a.test/p?x=1&y=2#frag"))
                    .containsExactly("https://a.test/p?x=1&y=2#frag");
        }
    }

    @Test
    void scheme_without_host_is_ignored() {
        assertThat(ex.extract("http:// nothing")).isEmpty();
        assertThat(ex.extract("http://...")).isEmpty();
    }

    @Test
    void no_normalization_is_applied() {
        assertThat(ex.extract("https://A.test/Path/ https://a.test/Path"))
                .containsExactly("https://A.test/Path/", "https://a.test/Path");
    }
}
