package com.goormthonuniv.factcheck.service;

import com.goormthonuniv.factcheck.search.SearchAdapter;
import com.goormthonuniv.factcheck.search.SearchResult;
import com.goormthonuniv.factcheck.verify.SourceClassifier;
import com.goormthonuniv.factcheck.verify.SourceType;
import org.junit.jupiter.api.Test;

import java.util.*;

import static org.assertj.core.api.Assertions.assertThat;

class CandidateCollectorTest {

    /** 쿼리별 고정 결과를 돌려주고 호출 횟수를 센다 */
    static class FakeAdapter implements SearchAdapter {
        final String name;
        final Map<String, List<String>> urlsByQuery = new HashMap<>();
        int calls;

        FakeAdapter(String name) { this.name = name; }

        FakeAdapter on(String query, String... urls) {
            urlsByQuery.put(query, List.of(urls));
            return this;
        }

        @Override public String name() { return name; }

        @Override
        public List<SearchResult> search(String query, int limit) {
            calls++;
            return urlsByQuery.getOrDefault(query, List.of()).stream()
                    .limit(limit)
                    .map(u -> new SearchResult(name, "title " + u, u, "snippet", null))
                    .toList();
        }
    }

    @Test
    void dedupesByHostAndPath_excludesOriginal_keepsPriorityOrder() {
        FakeAdapter news = new FakeAdapter("newsapi")
                .on("q1", "https://www.reuters.com/a", "https://example.com/original")
                .on("q2", "https://reuters.com/a/?utm=1", "https://whitehouse.gov/b");
        FakeAdapter google = new FakeAdapter("google_cse")
                .on("q1", "https://m.reuters.com/a#frag", "https://blog.example.net/c");
        CandidateCollector collector = new CandidateCollector(List.of(news, google), new SourceClassifier());

        List<CandidateSource> out = collector.collect(List.of("q1", "q2"), "https://www.example.com/original/", 10, 5);

        assertThat(out).extracting(CandidateSource::url)
                .containsExactly("https://www.reuters.com/a", "https://blog.example.net/c", "https://whitehouse.gov/b");
        assertThat(out).extracting(CandidateSource::id).containsExactly("source-1", "source-2", "source-3");
        assertThat(out).extracting(CandidateSource::sourceType)
                .containsExactly(SourceType.NEWS, SourceType.BLOG, SourceType.OFFICIAL);
        assertThat(out.get(0).adapter()).isEqualTo("newsapi");
    }

    @Test
    void stopsAtMaxSources() {
        FakeAdapter a = new FakeAdapter("a").on("q1", "https://x.com/1", "https://y.com/2", "https://z.com/3");
        FakeAdapter b = new FakeAdapter("b").on("q1", "https://w.com/4");
        CandidateCollector collector = new CandidateCollector(List.of(a, b), new SourceClassifier());

        List<CandidateSource> out = collector.collect(List.of("q1", "q2"), null, 2, 5);

        assertThat(out).hasSize(2);
        assertThat(b.calls).isZero();
    }

    @Test
    void searchResultsAreCachedPerQuery() {
        FakeAdapter a = new FakeAdapter("a").on("q1", "https://x.com/1");
        CandidateCollector collector = new CandidateCollector(List.of(a), new SourceClassifier());

        collector.collect(List.of("q1"), null, 10, 5);
        collector.collect(List.of("q1"), null, 10, 5);

        assertThat(a.calls).isEqualTo(1);
    }

    @Test
    void failingAdapterIsSkipped() {
        SearchAdapter broken = new FakeAdapter("broken") {
            @Override
            public List<SearchResult> search(String query, int limit) {
                throw new IllegalStateException("boom");
            }
        };
        FakeAdapter ok = new FakeAdapter("ok").on("q1", "https://x.com/1");
        CandidateCollector collector = new CandidateCollector(List.of(broken, ok), new SourceClassifier());

        assertThat(collector.collect(List.of("q1"), null, 10, 5)).hasSize(1);
    }
}
