package com.urlsentry.core.discovery;

import com.urlsentry.core.model.UrlOccurrence;

import java.nio.file.Path;
import java.util.ArrayDeque;
import java.util.Iterator;
import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/**
 * 파일 내용 하나에 대한 URL 등장 시퀀스.
 * 지연 평가되고, iterator()를 부를 때마다 처음부터 다시 훑는다(재시작 가능).
 * 줄 구분은 \n, \r\n, \r 모두 허용. 줄 번호는 1부터.
 */
public final class ContentUrls implements Iterable<UrlOccurrence> {
    private final UrlExtractor extractor;
    private final Path file;
    private final String content;

    public ContentUrls(UrlExtractor extractor, Path file, String content) {
        this.extractor = Objects.requireNonNull(extractor, "extractor");
        this.file = Objects.requireNonNull(file, "file");
        this.content = (content == null) ? "" : content;
    }

    @Override
    public Iterator<UrlOccurrence> iterator() {
        return new LineIterator();
    }

    public Stream<UrlOccurrence> stream() {
        return StreamSupport.stream(
                Spliterators.spliteratorUnknownSize(iterator(), Spliterator.ORDERED | Spliterator.NONNULL),
                false);
    }

    /** 사전 필터를 통과하는 줄 수(용량 어림용). 정규식은 돌리지 않는다. */
    public int candidateLineCount() {
        int n = 0;
        int pos = 0;
        int len = content.length();
        while (pos < len) {
            int end = lineEnd(pos);
            if (extractor.mayContainUrl(content.substring(pos, end))) n++;
            pos = nextLineStart(end);
        }
        return n;
    }

    private int lineEnd(int from) {
        int len = content.length();
        for (int i = from; i < len; i++) {
            char c = content.charAt(i);
            if (c == '\n' || c == '\r') return i;
        }
        return len;
    }

    private int nextLineStart(int lineEnd) {
        int len = content.length();
        if (lineEnd >= len) return len;
        if (content.charAt(lineEnd) == '\r' && lineEnd + 1 < len && content.charAt(lineEnd + 1) == '\n') {
            return lineEnd + 2;
        }
        return lineEnd + 1;
    }

    private final class LineIterator implements Iterator<UrlOccurrence> {
        private final ArrayDeque<UrlOccurrence> pending = new ArrayDeque<>(4);
        private int pos = 0;
        private int lineNo = 0;

        @Override
        public boolean hasNext() {
            while (pending.isEmpty() && pos < content.length()) {
                int end = lineEnd(pos);
                lineNo++;
                String line = content.substring(pos, end);
                for (String url : extractor.extract(line)) {
                    pending.add(new UrlOccurrence(url, file, lineNo));
                }
                pos = nextLineStart(end);
            }
            return !pending.isEmpty();
        }

        @Override
        public UrlOccurrence next() {
            if (!hasNext()) throw new NoSuchElementException();
            return pending.poll();
        }
    }
}
