package com.goormthonuniv.factcheck.dto;

import com.fasterxml.jackson.annotation.JsonIgnore;
import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;

public record AnalyzeRequest(
        @Pattern(regexp = "^https?://.+", message = "must be an http(s) URL")
        String url,                  // 원문 링크 (url/text 중 하나 필수)
        @Size(max = 100_000) String text,
        @Size(max = 500) String title  // 선택
) {
    @JsonIgnore
    @AssertTrue(message = "url 또는 text 중 하나는 필요합니다")
    public boolean isInputPresent() {
        return (url != null && !url.isBlank()) || (text != null && !text.isBlank());
    }

    @JsonIgnore
    public boolean hasText() {
        return text != null && !text.isBlank();
    }
}
