package com.goormthonuniv.factcheck.fact;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.goormthonuniv.factcheck.util.TextUtils;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;

/**
 * 추출 서비스 출력(JSON)을 FactHierarchy로 변환한다. 네트워크/랜덤 없음.
 *
 * 규칙
 * - what_facts[].event, claims[].claim 텍스트가 비어 있는 항목은 건너뜀
 * - importance/confidence 는 high|medium|low 밖이면 medium
 * - related_who/where/when 누락 시 빈 리스트 (단일 문자열이면 1개짜리 리스트)
 * - what_facts, claims 키가 둘 다 없거나 배열이 아니면 MalformedExtractionException
 */
@Slf4j
public final class FactHierarchyParser {

    private static final ObjectMapper OM = new ObjectMapper();

    private FactHierarchyParser() {}

    public static FactHierarchy parse(String sourceId, String rawJson) {
        String json = TextUtils.stripCodeFence(rawJson);
        if (json.isEmpty()) {
            throw new MalformedExtractionException(sourceId, "extraction output is empty");
        }
        JsonNode root;
        try {
            root = OM.readTree(json);
        } catch (JsonProcessingException e) {
            throw new MalformedExtractionException(sourceId, "extraction output is not valid JSON: " + e.getOriginalMessage(), e);
        }
        return parse(sourceId, root);
    }

    public static FactHierarchy parse(String sourceId, JsonNode root) {
        if (root == null || !root.isObject()) {
            throw new MalformedExtractionException(sourceId, "extraction output is not a JSON object");
        }
        JsonNode what = field(root, "what_facts", "whatFacts");
        JsonNode claims = field(root, "claims");
        if (what == null && claims == null) {
            throw new MalformedExtractionException(sourceId, "neither what_facts nor claims present");
        }
        if ((what != null && !what.isArray()) || (claims != null && !claims.isArray())) {
            throw new MalformedExtractionException(sourceId, "what_facts / claims must be arrays");
        }

        List<Fact> whatFacts = read(sourceId, what, FactKind.EVENT, "event");
        List<Fact> claimFacts = read(sourceId, claims, FactKind.CLAIM, "claim");
        log.debug("parsed hierarchy source={} what={} claims={}", sourceId, whatFacts.size(), claimFacts.size());
        return new FactHierarchy(sourceId, whatFacts, claimFacts);
    }

    private static List<Fact> read(String sourceId, JsonNode array, FactKind kind, String textKey) {
        List<Fact> out = new ArrayList<>();
        if (array == null) return out;
        for (JsonNode item : array) {
            if (!item.isObject()) continue;
            String text = TextUtils.normalizeSpaces(item.path(textKey).asText(""));
            if (text.isEmpty()) continue;
            out.add(new Fact(
                    kind.idPrefix() + (out.size() + 1),
                    sourceId,
                    kind,
                    text,
                    Level.parse(textOrNull(item.get("importance"))),
                    Level.parse(textOrNull(item.get("confidence"))),
                    strings(field(item, "related_who", "relatedWho")),
                    strings(field(item, "related_where", "relatedWhere")),
                    strings(field(item, "related_when", "relatedWhen"))
            ));
        }
        return out;
    }

    private static List<String> strings(JsonNode node) {
        List<String> out = new ArrayList<>();
        if (node == null || node.isNull()) return out;
        if (node.isTextual()) {
            addIfPresent(out, node.asText());
            return out;
        }
        if (node.isArray()) {
            for (JsonNode v : node) {
                if (v.isValueNode() && !v.isNull()) addIfPresent(out, v.asText());
            }
        }
        return out;
    }

    private static void addIfPresent(List<String> out, String v) {
        String s = TextUtils.normalizeSpaces(v);
        if (!s.isEmpty()) out.add(s);
    }

    private static String textOrNull(JsonNode node) {
        return node == null || !node.isTextual() ? null : node.asText();
    }

    private static JsonNode field(JsonNode obj, String... names) {
        for (String n : names) {
            JsonNode v = obj.get(n);
            if (v != null && !v.isNull()) return v;
        }
        return null;
    }
}
