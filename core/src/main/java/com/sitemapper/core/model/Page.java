package com.sitemapper.core.model;

import java.net.URI;
import java.util.List;
import java.util.Objects;

/**
 * 사이트맵 한 페이지. 저장 후 불변(부분 갱신 없음).
 * placeholder=true 는 fetch 전에 경로를 선점해 둔 빈 레코드.
 *
 * @param url         정규(canonical) URL
 * @param links       같은 host 링크 (발견 순서 유지)
 * @param assets      같은 host 정적 리소스 URL (img/script/link)
 * @param placeholder 실제 내용 없이 경로만 선점한 레코드인지
 */
public record Page(URI url, List<URI> links, List<String> assets, boolean placeholder) {

    public Page {
        Objects.requireNonNull(url, "url");
        links = (links == null) ? List.of() : List.copyOf(links);
        assets = (assets == null) ? List.of() : List.copyOf(assets);
    }

    public static Page of(URI url, List<URI> links, List<String> assets) {
        return new Page(url, links, assets, false);
    }

    public static Page placeholder(URI url) {
        return new Page(url, List.of(), List.of(), true);
    }
}
