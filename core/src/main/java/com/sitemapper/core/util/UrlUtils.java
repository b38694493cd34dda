package com.sitemapper.core.util;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.Locale;

/** URL 정규화 + same-host 판정 + 사이트맵 키 유틸 */
public final class UrlUtils {
    private UrlUtils(){}

    /**
     * 정규화 규칙:
     * - fragment 제거(#... 제거)
     * - scheme/host 소문자
     * - 기본 포트 제거(http:80, https:443)
     * - 빈/누락 경로를 "/"로, 중복 슬래시 축소
     */
    public static URI normalize(URI u) {
        if (u == null) return null;

        String scheme = (u.getScheme() == null ? "http" : u.getScheme()).toLowerCase(Locale.ROOT);
        String host = u.getHost() != null ? u.getHost() : u.getAuthority();
        if (host == null) host = "";
        host = host.toLowerCase(Locale.ROOT);

        int port = u.getPort();
        if ((scheme.equals("http") && port == 80) || (scheme.equals("https") && port == 443)) {
            port = -1; // 기본 포트 제거
        }

        String path = (u.getPath() == null || u.getPath().isEmpty()) ? "/" : u.getPath();
        path = path.replaceAll("/{2,}", "/");

        try {
            return new URI(scheme, null, host, port, path, u.getQuery(), null); // fragment 제거
        } catch (URISyntaxException e) {
            return u;
        }
    }

    /**
     * scheme 없는 입력("example.com/a")에 기본 scheme을 붙인다.
     * 이미 "://"가 있으면 그대로 둔다.
     */
    public static String withDefaultScheme(String raw, String defaultScheme) {
        if (raw == null) return null;
        String s = raw.trim();
        if (s.isEmpty() || s.contains("://")) return s;
        String scheme = (defaultScheme == null || defaultScheme.isBlank()) ? "http" : defaultScheme;
        if (s.startsWith("//")) return scheme + ":" + s;
        return scheme + "://" + s;
    }

    /**
     * 사이트맵 키: 정규화된 경로. 쿼리/fragment는 키에 포함하지 않는다.
     * "/a?x=1" 과 "/a?x=2" 는 같은 키 "/a".
     */
    public static String pathKey(URI u) {
        if (u == null) return "/";
        URI n = normalize(u);
        String p = n.getRawPath();
        return (p == null || p.isEmpty()) ? "/" : p;
    }

    /** host + 명시 포트 기준 동일 호스트 판정(소문자 비교). 기본 포트/scheme 차이는 무시 */
    public static boolean sameHost(URI a, URI b) {
        if (a == null || b == null) return false;
        if (a.getHost() == null || b.getHost() == null) return false;
        if (!a.getHost().equalsIgnoreCase(b.getHost())) return false;
        return explicitPort(a) == explicitPort(b);
    }

    /** http/https 만 크롤 대상 */
    public static boolean isHttpLike(URI u) {
        if (u == null || u.getScheme() == null) return false;
        String s = u.getScheme().toLowerCase(Locale.ROOT);
        return s.equals("http") || s.equals("https");
    }

    private static int explicitPort(URI u) {
        int port = u.getPort();
        String s = u.getScheme() == null ? "http" : u.getScheme().toLowerCase(Locale.ROOT);
        if ((s.equals("http") && port == 80) || (s.equals("https") && port == 443)) return -1;
        return port;
    }
}
