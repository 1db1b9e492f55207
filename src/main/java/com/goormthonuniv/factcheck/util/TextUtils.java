package com.goormthonuniv.factcheck.util;

import java.util.Arrays;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

public final class TextUtils {
    private static final Pattern FENCE = Pattern.compile("```(?:json)?\\s*(.*?)```", Pattern.DOTALL);
    private static final Pattern SPACES = Pattern.compile("\\s+");

    private TextUtils() {}

    public static boolean notBlank(String s) { return s != null && !s.isBlank(); }

    /** 공백 정리 + strip */
    public static String normalizeSpaces(String s) {
        if (s == null) return "";
        return SPACES.matcher(s.strip()).replaceAll(" ");
    }

    /** 최대 max 글자까지 자름 */
    public static String truncate(String s, int max) {
        if (s == null) return "";
        return s.length() <= max ? s : s.substring(0, max);
    }

    /** 앞에서 maxWords 단어만 남김 */
    public static String firstWords(String s, int maxWords) {
        String n = normalizeSpaces(s);
        if (n.isEmpty()) return n;
        String[] words = n.split(" ");
        if (words.length <= maxWords) return n;
        return Arrays.stream(words).limit(maxWords).collect(Collectors.joining(" "));
    }

    /** 첫 문장('.' 이전) */
    public static String firstSentence(String s) {
        String n = normalizeSpaces(s);
        int dot = n.indexOf('.');
        return dot < 0 ? n : n.substring(0, dot).strip();
    }

    /** LLM 응답의 ```json ... ``` 펜스 제거 */
    public static String stripCodeFence(String text) {
        if (text == null) return "";
        Matcher m = FENCE.matcher(text);
        if (m.find()) return m.group(1).strip();
        return text.strip();
    }
}
