package com.underwriting.engine.domain;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * A received test result on a case.
 */
public class TestResult {

    @JsonProperty("testName")
    private String testName;

    @JsonProperty("resultValue")
    private String resultValue;

    public TestResult() {
    }

    public TestResult(String testName, String resultValue) {
        this.testName = testName;
        this.resultValue = resultValue;
    }

    public String getTestName() {
        return testName;
    }

    public void setTestName(String testName) {
        this.testName = testName;
    }

    public String getResultValue() {
        return resultValue;
    }

    public void setResultValue(String resultValue) {
        this.resultValue = resultValue;
    }

    /**
     * Display form used in override snapshots, e.g. {@code HbA1c: 7.2}.
     */
    public String toDisplayString() {
        return testName + ": " + resultValue;
    }
}
