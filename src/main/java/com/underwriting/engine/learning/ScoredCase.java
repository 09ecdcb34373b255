package com.underwriting.engine.learning;

import com.underwriting.engine.domain.CaseRecord;

/**
 * A candidate case with its similarity to the target, in {@code [0, 100]}.
 */
public record ScoredCase(CaseRecord caseRecord, int similarity) {
}
