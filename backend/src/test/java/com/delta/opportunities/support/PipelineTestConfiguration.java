package com.delta.opportunities.support;

import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Primary;

@TestConfiguration
public class PipelineTestConfiguration {

    @Bean
    @Primary
    public ScriptedGenerator scriptedGenerator() {
        return new ScriptedGenerator();
    }

    @Bean
    public FakeBoardAdapter fakeBoardAdapter() {
        return new FakeBoardAdapter();
    }
}
