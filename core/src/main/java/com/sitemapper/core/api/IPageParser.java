package com.sitemapper.core.api;

import com.sitemapper.core.model.FetchedPage;
import com.sitemapper.core.model.ParseResult;

/**
 * 페이지 파싱 계약: 문서 host와 같은 링크/정적 리소스만 돌려준다.
 * 파싱 예외는 호출자가 빈 결과로 처리한다.
 */
@FunctionalInterface
public interface IPageParser {
    ParseResult parse(FetchedPage page);
}
