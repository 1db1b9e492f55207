package com.goormthonuniv.factcheck.service;

public class ArticleFetchException extends RuntimeException {

    private final String url;

    public ArticleFetchException(String url, String message) {
        super(message);
        this.url = url;
    }

    public ArticleFetchException(String url, String message, Throwable cause) {
        super(message, cause);
        this.url = url;
    }

    public String getUrl() { return url; }
}
