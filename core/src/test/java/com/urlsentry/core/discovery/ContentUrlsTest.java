package com.urlsentry.core.discovery;

import com.urlsentry.core.model.UrlOccurrence;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class ContentUrlsTest {

    private static final Path FILE = Path.of("docs/README.md");
    private final UrlExtractor ex = new UrlExtractor();

    @Test
    void line_numbers_are_one_based_for_all_line_endings() {
        String content = "intro\nhttps://a.test/1\r\nplain\rhttps://b.test/2 https://c.test/3\n";
        List<UrlOccurrence> found = new ContentUrls(ex, FILE, content).stream().toList();

        assertThat(found).extracting(UrlOccurrence::url)
                .containsExactly("https://a.test/1", "https://b.test/2", "https://c.test/3");
        assertThat(found).extracting(UrlOccurrence::line).containsExactly(2, 4, 4);
        assertThat(found).allMatch(o -> o.file().equals(FILE));
    }

    @Test
    void sequence_is_restartable() {
        ContentUrls urls = new ContentUrls(ex, FILE, "https://a.test\nhttps://b.test\n");
        List<String> first = new ArrayList<>();
        for (UrlOccurrence o : urls) first.add(o.url());
        List<String> second = new ArrayList<>();
        for (UrlOccurrence o : urls) second.add(o.url());

        assertThat(first).containsExactly("https://a.test", "https://b.test");
        assertThat(second).isEqualTo(first);
    }

    @Test
    void empty_and_null_content_yield_nothing() {
        assertThat(new ContentUrls(ex, FILE, "").iterator().hasNext()).isFalse();
        assertThat(new ContentUrls(ex, FILE, null).iterator().hasNext()).isFalse();
    }

    @Test
    void candidate_line_count_uses_prefilter_only() {
        String content = "http is a word\nhttps://a.test\nnothing\n";
        assertThat(new ContentUrls(ex, FILE, content).candidateLineCount()).isEqualTo(2);
    }
}
