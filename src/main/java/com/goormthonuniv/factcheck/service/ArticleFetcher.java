package com.goormthonuniv.factcheck.service;

import com.goormthonuniv.factcheck.config.FactCheckProperties;
import com.goormthonuniv.factcheck.util.TextUtils;
import com.goormthonuniv.factcheck.util.UrlUtils;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.select.Elements;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.stream.Collectors;

/**
 * 기사 HTML → 제목 + 본문 텍스트.
 * 본문: article 안의 p → main / 본문 div 안의 p → 문서 앞쪽 p 20개
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ArticleFetcher {

    private static final String USER_AGENT = "Mozilla/5.0 (Windows NT 10.0; Win64; x64) AppleWebKit/537.36";
    private static final int FALLBACK_PARAGRAPHS = 20;

    private final FactCheckProperties props;

    public FetchedArticle fetch(String url) {
        Document doc;
        try {
            doc = Jsoup.connect(url)
                    .userAgent(USER_AGENT)
                    .timeout((int) props.getFetchTimeout().toMillis())
                    .followRedirects(true)
                    .get();
        } catch (IOException | IllegalArgumentException e) {
            throw new ArticleFetchException(url, "fetch failed: " + e.getMessage(), e);
        }
        FetchedArticle article = extract(url, doc);
        if (article.content().isBlank()) {
            throw new ArticleFetchException(url, "no article text found");
        }
        log.debug("fetched url={} chars={}", url, article.content().length());
        return article;
    }

    static FetchedArticle extract(String url, Document doc) {
        Element h1 = doc.selectFirst("h1");
        String title = h1 != null ? h1.text().strip() : doc.title().strip();
        if (title.isEmpty()) title = "No title";

        String content = "";
        Element article = doc.selectFirst("article");
        if (article != null) {
            content = join(article.select("p"));
        }
        if (content.isEmpty()) {
            Element main = doc.selectFirst("main");
            if (main == null) main = doc.selectFirst("div.article-content, div.post-content, div.entry-content");
            if (main != null) content = join(main.select("p"));
        }
        if (content.isEmpty()) {
            Elements ps = doc.select("p");
            content = join(new Elements(ps.subList(0, Math.min(FALLBACK_PARAGRAPHS, ps.size()))));
        }
        return new FetchedArticle(url, UrlUtils.normalizeHost(url), title, content);
    }

    private static String join(Elements paragraphs) {
        return TextUtils.normalizeSpaces(paragraphs.stream()
                .map(Element::text)
                .map(String::strip)
                .filter(s -> !s.isEmpty())
                .collect(Collectors.joining(" ")));
    }
}
