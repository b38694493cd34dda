package com.sitemapper.core.model;

import java.net.URI;
import java.util.List;

/** 파서 결과: 같은 host 링크 + 정적 리소스 */
public record ParseResult(List<URI> links, List<String> assets) {

    public static final ParseResult EMPTY = new ParseResult(List.of(), List.of());

    public ParseResult {
        links = (links == null) ? List.of() : List.copyOf(links);
        assets = (assets == null) ? List.of() : List.copyOf(assets);
    }
}
