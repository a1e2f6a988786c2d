package com.streamscout.core.model;

import java.util.Objects;

/** 후보 하나에 대한 검증 결과. url 단위로 한 번만 만들어진다. */
public record ValidationResult(Candidate candidate, boolean valid) {
    public ValidationResult {
        Objects.requireNonNull(candidate, "candidate");
    }
}
