package com.goormthonuniv.factcheck.llm;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.goormthonuniv.factcheck.util.TextUtils;
import com.goormthonuniv.factcheck.verify.ComparisonResult;
import com.goormthonuniv.factcheck.verify.ComparisonVerdict;
import com.goormthonuniv.factcheck.verify.InvalidComparisonException;
import com.goormthonuniv.factcheck.verify.VerdictOutcome;

import java.util.ArrayList;
import java.util.List;

/**
 * 비교 응답 JSON → ComparisonResult.
 * {
 *   "relevance_score": 0.0~1.0 | null,
 *   "verdicts": [{"original_id", "outcome", "source_id", "match_strength", "conflict_type", "conflict_severity"}],
 *   "analysis_notes": "..."
 * }
 * id 참조 검사는 VerdictValidator 몫. 여기서는 형태만 본다.
 */
public final class ComparisonResponseParser {

    private static final ObjectMapper OM = new ObjectMapper();

    private ComparisonResponseParser() {}

    public static ComparisonResult parse(String raw) {
        String json = TextUtils.stripCodeFence(raw);
        JsonNode root;
        try {
            root = OM.readTree(json);
        } catch (JsonProcessingException e) {
            throw new InvalidComparisonException("comparison output is not valid JSON: " + e.getOriginalMessage());
        }
        if (root == null || !root.isObject()) {
            throw new InvalidComparisonException("comparison output is not a JSON object");
        }
        JsonNode verdicts = root.get("verdicts");
        if (verdicts == null || !verdicts.isArray()) {
            throw new InvalidComparisonException("comparison output has no verdicts array");
        }

        List<ComparisonVerdict> out = new ArrayList<>();
        for (JsonNode v : verdicts) {
            String originalId = text(v, "original_id");
            if (originalId == null) {
                throw new InvalidComparisonException("verdict without original_id");
            }
            String rawOutcome = text(v, "outcome");
            VerdictOutcome outcome = VerdictOutcome.parse(rawOutcome);
            if (outcome == null) {
                throw new InvalidComparisonException("unknown verdict outcome '" + rawOutcome + "' for " + originalId);
            }
            out.add(new ComparisonVerdict(
                    originalId,
                    outcome,
                    text(v, "source_id"),
                    text(v, "match_strength"),
                    text(v, "conflict_type"),
                    text(v, "conflict_severity")));
        }

        JsonNode score = root.get("relevance_score");
        Double relevance = score != null && score.isNumber() ? score.asDouble() : null;
        return new ComparisonResult(relevance, out, text(root, "analysis_notes"));
    }

    private static String text(JsonNode obj, String key) {
        JsonNode n = obj.get(key);
        if (n == null || n.isNull() || !n.isValueNode()) return null;
        String s = n.asText().strip();
        return s.isEmpty() ? null : s;
    }
}
