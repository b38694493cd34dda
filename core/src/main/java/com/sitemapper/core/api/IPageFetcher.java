package com.sitemapper.core.api;

import com.sitemapper.core.http.FetchException;
import com.sitemapper.core.model.FetchedPage;

import java.net.URI;

/** 페이지 fetch 최소 계약: URL을 받아 응답을 돌려주거나 실패를 던진다. */
public interface IPageFetcher {
    /**
     * @throws FetchException       네트워크 오류/비-2xx 응답 (호출자가 URL을 버린다)
     * @throws InterruptedException 종료 중 인터럽트
     */
    FetchedPage fetch(URI url) throws FetchException, InterruptedException;
}
