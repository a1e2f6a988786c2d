package com.streamscout.core.extract;

import com.streamscout.core.model.Candidate;

import java.util.Set;

/** 검색 결과 페이지 원문에서 후보 링크를 추출하는 전략 인터페이스. */
public interface LinkExtractor {
    /**
     * 순수 함수: 네트워크/부수효과 없음. 매치가 없으면 빈 집합(예외 아님).
     *
     * @param pageText 페이지 원문(null 허용)
     * @param channel  후보에 붙일 출처 채널명
     */
    Set<Candidate> extract(String pageText, String channel);
}
