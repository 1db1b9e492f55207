package com.goormthonuniv.factcheck.util;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.List;
import java.util.Locale;

public final class UrlUtils {

    private static final List<String> COMMON_PREFIXES = List.of("www.", "m.", "mobile.", "amp.");

    private UrlUtils() {}

    /** 입력이 URL이든 호스트든 받아서 정규화된 host를 반환 (www./m./mobile./amp. 한 번 제거) */
    public static String normalizeHost(String urlOrHost) {
        if (urlOrHost == null || urlOrHost.isBlank()) return null;
        String raw = urlOrHost.trim().toLowerCase(Locale.ROOT);

        String host = raw;
        if (raw.contains("://")) {
            URI uri = parse(raw);
            if (uri != null && uri.getHost() != null) host = uri.getHost();
        } else if (raw.contains("/")) {
            // "host/path" 형태
            URI uri = parse("https://" + raw);
            if (uri != null && uri.getHost() != null) host = uri.getHost();
        }
        return stripCommonSubdomainPrefix(host.toLowerCase(Locale.ROOT));
    }

    /**
     * 중복 제거 키: 정규화 host + 정규화 path. query/fragment 버림, 끝 '/' 제거.
     * 파싱 불가 URL은 소문자 원문 그대로.
     */
    public static String dedupeKey(String url) {
        if (url == null || url.isBlank()) return "";
        URI uri = parse(url.trim());
        if (uri == null || uri.getHost() == null) return url.trim().toLowerCase(Locale.ROOT);
        String host = stripCommonSubdomainPrefix(uri.getHost().toLowerCase(Locale.ROOT));
        String path = uri.getRawPath() == null ? "" : uri.getRawPath();
        while (path.endsWith("/")) path = path.substring(0, path.length() - 1);
        return host + path;
    }

    public static String stripCommonSubdomainPrefix(String host) {
        if (host == null) return null;
        for (String pref : COMMON_PREFIXES) {
            if (host.startsWith(pref)) {
                return host.substring(pref.length());
            }
        }
        return host;
    }

    private static URI parse(String s) {
        try {
            return new URI(s);
        } catch (URISyntaxException e) {
            return null;
        }
    }
}
