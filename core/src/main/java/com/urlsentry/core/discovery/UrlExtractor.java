package com.urlsentry.core.discovery;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 한 줄의 텍스트에서 http/https URL을 뽑아내는 추출기.
 * 불변 객체라 여러 스레드/파일에서 같은 인스턴스를 공유해도 된다.
 *
 * <p>2단계 처리:
 * <ol>
 *   <li>{@link #mayContainUrl(String)}: "http" 부분 문자열만 훑는 싼 사전 필터</li>
 *   <li>{@link #extract(String)}: 정규식으로 scheme/authority/path/query/fragment 인식 후
 *       문장부호/짝 없는 닫는 괄호 같은 꼬리 제거</li>
 * </ol>
 */
public final class UrlExtractor {

    private static final String UNRESERVED = "\\p{L}\\p{N}\\-._~%";
    private static final String SUB_DELIMS = "!$&*+,;=";

    private static final String AUTHORITY = "[" + UNRESERVED + SUB_DELIMS + ":@]+";
    private static final String PATH      = "(?:/[" + UNRESERVED + SUB_DELIMS + ":@/()]*)?";
    private static final String QUERY     = "(?:\\?[" + UNRESERVED + SUB_DELIMS + ":@/?()]*)?";
    private static final String FRAGMENT  = "(?:#[" + UNRESERVED + SUB_DELIMS + ":@/?()]*)?";

    static final String URL_REGEX =
            "(?i)\\bhttps?://" + AUTHORITY + PATH + QUERY + FRAGMENT;

    /** 꼬리에 붙으면 URL이 아니라 문장의 일부로 보는 문자 */
    private static final String TRAILING_PUNCT = ".,;:!?*'\"";

    private static final int MIN_URL_LEN = "http://x".length();

    private final Pattern pattern;

    public UrlExtractor() {
        this.pattern = Pattern.compile(URL_REGEX);
    }

    /** 싼 사전 검사: 대소문자 무시 "http" 포함 여부 */
    public boolean mayContainUrl(String line) {
        if (line == null) return false;
        int last = line.length() - MIN_URL_LEN;
        for (int i = 0; i <= last; i++) {
            char c = line.charAt(i);
            if ((c == 'h' || c == 'H') && line.regionMatches(true, i, "http", 0, 4)) return true;
        }
        return false;
    }

    /** 줄 안의 URL을 등장 순서대로 반환(중복 포함). */
    public List<String> extract(String line) {
        if (!mayContainUrl(line)) return List.of();
        List<String> out = new ArrayList<>(2);
        Matcher m = pattern.matcher(line);
        while (m.find()) {
            String url = trimTrailing(m.group());
            if (hasHost(url)) out.add(url);
        }
        return out;
    }

    static String trimTrailing(String url) {
        int end = url.length();
        while (end > 0) {
            char c = url.charAt(end - 1);
            if (TRAILING_PUNCT.indexOf(c) >= 0) {
                end--;
            } else if (c == ')' && count(url, '(', end) < count(url, ')', end)) {
                end--;
            } else {
                break;
            }
        }
        return url.substring(0, end);
    }

    private static int count(String s, char c, int end) {
        int n = 0;
        for (int i = 0; i < end; i++) if (s.charAt(i) == c) n++;
        return n;
    }

    /** "://" 뒤 authority에 문자/숫자가 하나라도 있어야 URL로 인정 */
    private static boolean hasHost(String url) {
        int start = url.indexOf("://");
        if (start < 0) return false;
        for (int i = start + 3; i < url.length(); i++) {
            char c = url.charAt(i);
            if (c == '/' || c == '?' || c == '#') break;
            if (Character.isLetterOrDigit(c)) return true;
        }
        return false;
    }
}
