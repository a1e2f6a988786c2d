package com.streamscout.core.search;

/** 검색 요청마다 붙는 불투명 세션 토큰 생성기. 코어는 값의 의미를 해석하지 않는다. */
@FunctionalInterface
public interface SearchTokenGenerator {
    String next();
}
