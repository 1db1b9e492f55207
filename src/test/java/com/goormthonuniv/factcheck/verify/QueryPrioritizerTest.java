package com.goormthonuniv.factcheck.verify;

import com.goormthonuniv.factcheck.fact.FactHierarchy;
import com.goormthonuniv.factcheck.fact.Level;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.goormthonuniv.factcheck.fact.FactFixtures.*;
import static org.assertj.core.api.Assertions.assertThat;

class QueryPrioritizerTest {

    private static final String O = FactHierarchy.ORIGINAL_ID;

    @Test
    void singleHighWhatFact_quotesEventAndFirstWho() {
        FactHierarchy h = hierarchy(O, what(O, "W1", "Company X launches Product Y", Level.HIGH, "Company X"));

        List<String> queries = QueryPrioritizer.prioritize(h, 3);

        assertThat(queries).containsExactly("\"Company X launches Product Y\" \"Company X\"");
    }

    @Test
    void tiersAreHighWhatThenHighClaimThenMediumWhat() {
        FactHierarchy h = hierarchy(O,
                what(O, "W1", "medium event", Level.MEDIUM),
                what(O, "W2", "high event", Level.HIGH),
                claim(O, "C1", "high claim", Level.HIGH),
                claim(O, "C2", "medium claim", Level.MEDIUM),
                what(O, "W3", "low event", Level.LOW));

        List<String> queries = QueryPrioritizer.prioritize(h, 10);

        assertThat(queries).containsExactly("\"high event\"", "\"high claim\"", "\"medium event\"");
    }

    @Test
    void insertionOrderIsKeptWithinTier_andCappedAtN() {
        FactHierarchy h = hierarchy(O,
                what(O, "W1", "first", Level.HIGH, "A"),
                what(O, "W2", "second", Level.HIGH, "B"),
                what(O, "W3", "third", Level.HIGH),
                claim(O, "C1", "claim", Level.HIGH));

        assertThat(QueryPrioritizer.prioritize(h, 2))
                .containsExactly("\"first\" \"A\"", "\"second\" \"B\"");
        assertThat(QueryPrioritizer.prioritize(h, 0)).isEmpty();
    }

    @Test
    void neverExceedsMaxQueries() {
        FactHierarchy h = simple(O, 6, 4);

        for (int n = 1; n <= 12; n++) {
            assertThat(QueryPrioritizer.prioritize(h, n)).hasSizeLessThanOrEqualTo(n);
        }
    }

    @Test
    void longPhrasesAreTruncated_eventTo10AndClaimTo15Words() {
        String longText = "one two three four five six seven eight nine ten eleven twelve thirteen fourteen fifteen sixteen";
        FactHierarchy h = hierarchy(O,
                what(O, "W1", longText, Level.HIGH),
                claim(O, "C1", longText, Level.HIGH));

        List<String> queries = QueryPrioritizer.prioritize(h, 3);

        assertThat(queries.get(0)).isEqualTo("\"one two three four five six seven eight nine ten\"");
        assertThat(queries.get(1)).endsWith("fifteen\"").doesNotContain("sixteen");
    }

    @Test
    void duplicateQueriesCollapse() {
        FactHierarchy h = hierarchy(O,
                what(O, "W1", "same event", Level.HIGH, "X"),
                what(O, "W2", "same event", Level.HIGH, "X"));

        assertThat(QueryPrioritizer.prioritize(h, 3)).hasSize(1);
    }

    @Test
    void fallbackUsesFirstSentences() {
        FactHierarchy h = hierarchy(O,
                what(O, "W1", "Rain fell. It was heavy.", Level.LOW),
                what(O, "W2", "Roads closed.", Level.LOW),
                what(O, "W3", "Ignored third.", Level.LOW),
                claim(O, "C1", "Mayor blamed drains. More text.", Level.MEDIUM));

        assertThat(QueryPrioritizer.prioritize(h, 3)).isEmpty();
        assertThat(QueryPrioritizer.fallbackQuery(h)).isEqualTo("Rain fell Roads closed Mayor blamed drains");
        assertThat(QueryPrioritizer.fallbackQuery(FactHierarchy.empty(O))).isEmpty();
    }
}
