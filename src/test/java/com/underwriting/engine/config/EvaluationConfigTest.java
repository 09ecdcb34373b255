package com.underwriting.engine.config;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class EvaluationConfigTest {

    @Test
    void injectedFlagEnablesDebugLogging() {
        EvaluationConfig config = new EvaluationConfig();
        config.debugEnabled = true;

        assertThat(config.shouldLogDebug()).isTrue();
    }

    @Test
    void followsStaticFlagWhenInjectedFlagIsOff() {
        EvaluationConfig config = new EvaluationConfig();

        assertThat(config.shouldLogDebug()).isEqualTo(EvaluationConfig.isStaticDebugEnabled());
    }
}
