package com.goormthonuniv.factcheck.llm;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.goormthonuniv.factcheck.fact.Fact;
import com.goormthonuniv.factcheck.fact.FactHierarchy;
import com.goormthonuniv.factcheck.verify.ComparisonResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;

@Slf4j
@Component
@RequiredArgsConstructor
public class OpenAiFactComparator implements FactComparator {

    private static final ObjectMapper OM = new ObjectMapper();

    private final OpenAiClient client;

    @Override
    public ComparisonResult compare(FactHierarchy original, FactHierarchy source) {
        String content = client.completeJson(Prompt.SYSTEM, Prompt.user(original, source));
        ComparisonResult result = ComparisonResponseParser.parse(content);
        log.debug("comparison source={} relevance={} verdicts={}",
                source.sourceId(), result.relevanceScore(), result.verdicts().size());
        return result;
    }

    /** 프롬프트에 넣을 계층 표현: id 를 붙인 fact 목록 */
    static String describe(FactHierarchy h) {
        ObjectNode root = OM.createObjectNode();
        root.set("what_facts", facts(h.whatFacts(), "event"));
        root.set("claims", facts(h.claims(), "claim"));
        try {
            return OM.writerWithDefaultPrettyPrinter().writeValueAsString(root);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("cannot serialize hierarchy " + h.sourceId(), e);
        }
    }

    private static ArrayNode facts(List<Fact> facts, String textKey) {
        ArrayNode arr = OM.createArrayNode();
        for (Fact f : facts) {
            ObjectNode n = arr.addObject();
            n.put("id", f.id());
            n.put(textKey, f.text());
            n.set("related_who", OM.valueToTree(f.relatedWho()));
            n.set("related_where", OM.valueToTree(f.relatedWhere()));
            n.set("related_when", OM.valueToTree(f.relatedWhen()));
            n.put("importance", f.importance().wireName());
        }
        return arr;
    }

    static class Prompt {
        static final String SYSTEM = """
        You are a fact-checking assistant. Compare facts from two sources using CONTEXT-AWARE matching.
        Facts match only when BOTH the event/claim AND its context (who/where/when) align.
        Don't match based on shared entities alone.

        MATCHING RULES:
        1. WHAT facts match if: same event/action + similar who/where/when context
        2. CLAIMS match if: same assertion + similar context
        3. Partial matches (same event, different details) are CONFLICTS, not matches
        4. Shared entities without same event context are NOT matches

        NUMBER COMPARISON:
        - difference < 30% of the larger number = MATCH with "moderate" strength (45 vs 60 -> 25% -> match)
        - only mark as conflict if the difference is >= 30%

        AMBIGUOUS EXPRESSIONS:
        - 0-20: "few", "some", "any"
        - 20-50: "some", "various", "many"
        - 50-200: "several", "many", "lot"
        - 200+: "huge", "massive", "big"
        An expression that aligns with the number range is a MATCH ("many people" vs "45 people").

        NO DUAL CLASSIFICATION:
        - give exactly ONE verdict per original fact id
        - if unsure between match and conflict, use match with "moderate" strength

        CONFLICT TYPES: "contradiction", "partial_mismatch", "emphasis_difference", "context_mismatch".

        RELEVANCE SCORE (0.0-1.0):
        - 0.8-1.0: highly relevant, covers the same core events
        - 0.5-0.7: moderately relevant, some overlap
        - 0.0-0.4: low relevance, different topics despite shared entities

        Return ONLY a JSON object:
        {
          "relevance_score": 0.0,
          "verdicts": [
            {"original_id": "W1", "outcome": "match|conflict|absent", "source_id": "W2 or null when absent",
             "match_strength": "strong|moderate|null", "conflict_type": "...|null", "conflict_severity": "high|medium|low|null"}
          ],
          "analysis_notes": "brief note on whether the sources cover the SAME events/claims"
        }
        Refer to facts ONLY by the given ids.
        """;

        static String user(FactHierarchy original, FactHierarchy source) {
            return "Original Source Facts:\n" + describe(original)
                    + "\n\nComparison Source Facts:\n" + describe(source);
        }
    }
}
