package com.goormthonuniv.factcheck.verify;

import com.goormthonuniv.factcheck.util.UrlUtils;
import org.springframework.stereotype.Component;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * 도메인 휴리스틱으로 SourceType을 정한다.
 *
 * 판정 순서
 * 1) 주요 언론 목록 (npr.org 처럼 .org 언론이 official로 새지 않게 먼저)
 * 2) 공식 서픽스 (.gov, .edu, .org, .mil, .int, gov.xx)
 * 3) 소셜
 * 4) 블로그 (호스트/서픽스 힌트)
 * 5) 뉴스 휴리스틱 (news. / -news. 등)
 * 6) UNKNOWN
 */
@Component
public class SourceClassifier {

    private final Set<String> majorNews = new LinkedHashSet<>();
    private final Set<String> officialSuffixes = new LinkedHashSet<>();
    private final Set<String> socialSuffixes = new LinkedHashSet<>();
    private final Set<String> blogSuffixes = new LinkedHashSet<>();
    private final List<String> blogHints = List.of("blog", "wordpress", "substack");

    public SourceClassifier() {
        // ===== 주요 언론 =====
        majorNews.addAll(List.of(
                "reuters.com", "apnews.com", "bbc.com", "bbc.co.uk", "cnn.com",
                "nytimes.com", "theguardian.com", "washingtonpost.com",
                "wsj.com", "bloomberg.com", "npr.org", "aljazeera.com", "ft.com"
        ));

        // ===== 공식/정부/기관 =====
        officialSuffixes.addAll(List.of(".gov", ".edu", ".org", ".mil", ".int"));

        // ===== 소셜 =====
        socialSuffixes.addAll(List.of(
                "twitter.com", "x.com", "facebook.com", "instagram.com",
                "tiktok.com", "reddit.com", "youtube.com", "threads.net"
        ));

        // ===== 블로그 플랫폼 =====
        blogSuffixes.addAll(List.of("medium.com", "substack.com", "tistory.com", "blogspot.com", "wordpress.com"));
    }

    public SourceType classify(String urlOrHost) {
        String host = UrlUtils.normalizeHost(urlOrHost);
        if (host == null || host.isEmpty()) return SourceType.UNKNOWN;

        if (matchesAny(host, majorNews)) return SourceType.NEWS;
        if (isOfficial(host)) return SourceType.OFFICIAL;
        if (matchesAny(host, socialSuffixes)) return SourceType.SOCIAL;
        if (matchesAny(host, blogSuffixes) || containsAny(host, blogHints)) return SourceType.BLOG;
        if (looksLikeNews(host)) return SourceType.NEWS;
        return SourceType.UNKNOWN;
    }

    private boolean isOfficial(String host) {
        for (String sfx : officialSuffixes) {
            if (host.endsWith(sfx)) return true;
        }
        // gov.uk, gov.kr, go.kr 등 국가별 정부 도메인
        return host.matches(".*(^|\\.)gov\\.[a-z]{2}$") || host.matches(".*(^|\\.)go\\.kr$");
    }

    private static boolean looksLikeNews(String host) {
        return host.startsWith("news.") ||
                host.contains(".news.") ||
                host.startsWith("news-") ||
                host.contains("-news.") ||
                host.endsWith(".news");
    }

    /** host가 목록의 도메인과 같거나 그 서브도메인인지 */
    private static boolean matchesAny(String host, Set<String> domains) {
        for (String d : domains) {
            if (host.equals(d) || host.endsWith("." + d)) return true;
        }
        return false;
    }

    private static boolean containsAny(String host, List<String> needles) {
        for (String n : needles) if (host.contains(n)) return true;
        return false;
    }
}
