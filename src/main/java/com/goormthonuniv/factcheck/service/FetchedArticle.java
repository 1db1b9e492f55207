package com.goormthonuniv.factcheck.service;

public record FetchedArticle(
        String url,
        String domain,
        String title,
        String content
) {}
