// IStreamProbe.java
package com.streamscout.core.api;

import com.streamscout.core.model.ProbeOutcome;

/** 검증 프로브 최소 계약: URL 하나를 확인하고 결과를 값으로 돌려준다. 예외를 던지지 않는다. */
@FunctionalInterface
public interface IStreamProbe {
    ProbeOutcome probe(String url);
}
