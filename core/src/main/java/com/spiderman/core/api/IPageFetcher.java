// IPageFetcher.java
package com.spiderman.core.api;

import com.spiderman.core.http.FetchException;
import com.spiderman.core.model.FetchedPage;

/** 페이지 fetch 최소 계약: URL → 본문. 실패는 FetchException 하나로 통일. */
public interface IPageFetcher extends AutoCloseable {
    FetchedPage fetch(String url) throws FetchException;
    @Override default void close() throws Exception {}
}
