package com.goormthonuniv.factcheck.util;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class TextUtilsTest {

    @Test
    void firstWordsAndSentence() {
        assertThat(TextUtils.firstWords("  a   b c d ", 2)).isEqualTo("a b");
        assertThat(TextUtils.firstWords("a b", 5)).isEqualTo("a b");
        assertThat(TextUtils.firstSentence("First one. Second.")).isEqualTo("First one");
        assertThat(TextUtils.firstSentence("No period")).isEqualTo("No period");
    }

    @Test
    void stripCodeFence() {
        assertThat(TextUtils.stripCodeFence("```json\n{\"a\":1}\n```")).isEqualTo("{\"a\":1}");
        assertThat(TextUtils.stripCodeFence("```\n[]\n```")).isEqualTo("[]");
        assertThat(TextUtils.stripCodeFence("  {}  ")).isEqualTo("{}");
        assertThat(TextUtils.stripCodeFence(null)).isEmpty();
    }

    @Test
    void truncate() {
        assertThat(TextUtils.truncate("abcdef", 3)).isEqualTo("abc");
        assertThat(TextUtils.truncate("ab", 3)).isEqualTo("ab");
    }
}
