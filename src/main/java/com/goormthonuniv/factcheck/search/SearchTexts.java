package com.goormthonuniv.factcheck.search;

import org.apache.commons.text.StringEscapeUtils;

final class SearchTexts {

    private SearchTexts() {}

    /** 검색 API 제목/스니펫의 태그·HTML 엔티티 정리 */
    static String clean(Object raw) {
        if (raw == null) return "";
        String s = raw.toString().replaceAll("<[^>]*>", "");
        return StringEscapeUtils.unescapeHtml4(s).replace('\u00A0', ' ').replaceAll("\\s+", " ").strip();
    }
}
