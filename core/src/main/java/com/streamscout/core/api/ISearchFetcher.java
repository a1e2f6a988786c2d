// ISearchFetcher.java
package com.streamscout.core.api;

import com.streamscout.core.model.Task;

/** 검색 fetch 최소 계약: (채널, 페이지) 작업을 받아 결과 페이지 원문을 돌려준다. */
public interface ISearchFetcher extends AutoCloseable {
    /**
     * @throws FetchException 타임아웃/전송 오류/비성공 상태코드
     */
    String fetch(Task task) throws FetchException;

    @Override default void close() throws Exception {}
}
