package com.costtracker.costs.support;

import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Primary;

@TestConfiguration
public class TestClockConfiguration {

    @Bean
    @Primary
    public MutableClock fixedClock() {
        return MutableClock.utc("2025-03-05T10:00:00Z");
    }
}
