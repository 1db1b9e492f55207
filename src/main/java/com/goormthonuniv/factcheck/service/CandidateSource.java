package com.goormthonuniv.factcheck.service;

import com.goormthonuniv.factcheck.verify.SourceType;

/**
 * 검색으로 찾은 비교 후보. id 는 실행 내에서 "source-1", "source-2" ...
 */
public record CandidateSource(
        String id,
        String url,
        String domain,
        String title,
        String snippet,
        SourceType sourceType,
        String adapter
) {}
