package com.goormthonuniv.factcheck.search;

import java.util.List;

/**
 * 외부 검색 API 하나. 설정 누락/네트워크 오류 시 예외 대신 빈 리스트.
 */
public interface SearchAdapter {
    String name(); // "google_cse", "newsapi"
    List<SearchResult> search(String query, int limit);
}
