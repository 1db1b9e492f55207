package com.goormthonuniv.factcheck.llm;

import com.goormthonuniv.factcheck.fact.FactHierarchy;
import com.goormthonuniv.factcheck.fact.FactHierarchyParser;
import com.goormthonuniv.factcheck.fact.MalformedExtractionException;
import com.goormthonuniv.factcheck.util.TextUtils;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

@Slf4j
@Component
@RequiredArgsConstructor
public class OpenAiFactExtractor implements FactExtractor {

    static final int MAX_ARTICLE_CHARS = 4000;

    private final OpenAiClient client;

    @Override
    public FactHierarchy extract(String sourceId, String title, String text) {
        if (!TextUtils.notBlank(text)) {
            throw new MalformedExtractionException(sourceId, "no article text to extract from");
        }
        String content = client.completeJson(Prompt.SYSTEM, Prompt.user(title, text));
        FactHierarchy h = FactHierarchyParser.parse(sourceId, content);
        if (h.isEmpty()) {
            log.warn("extraction returned no facts source={}", sourceId);
        }
        return h;
    }

    static class Prompt {
        static final String SYSTEM = """
        You are a fact-checking assistant. Analyze the article and extract facts using a HIERARCHICAL structure
        where events and claims are primary, and people/places/times are related entities.

        Extract facts in TWO PRIMARY CATEGORIES:
        1. WHAT FACTS (events/actions/occurrences): the event, related_who, related_where, related_when, importance.
        2. CLAIMS (assertions/statements): the claim, related_who, related_where, related_when, importance.

        IMPORTANCE: "high" = core events/claims that define the main topic, "medium" = supporting details,
        "low" = minor or tangential details.
        CONFIDENCE: "high" = clearly stated, "medium" = implied, "low" = uncertain.

        Return ONLY a JSON object with this exact structure:
        {
          "what_facts": [
            {"event": "...", "related_who": ["..."], "related_where": ["..."], "related_when": ["..."],
             "importance": "high", "confidence": "high"}
          ],
          "claims": [
            {"claim": "...", "related_who": ["..."], "related_where": ["..."], "related_when": ["..."],
             "importance": "high", "confidence": "high"}
          ]
        }

        Rules:
        - each WHAT fact includes the event plus its who/where/when context, each claim the assertion plus its context
        - keep descriptions focused (2-3 sentences max)
        - include 3-7 WHAT facts and 2-5 claims, quality over quantity
        """;

        static String user(String title, String text) {
            String titleLine = TextUtils.notBlank(title) ? "Title: " + title.strip() + "\n" : "";
            return titleLine + "Article:\n" + TextUtils.truncate(text, MAX_ARTICLE_CHARS);
        }
    }
}
