package com.costtracker.costs.config;

import java.time.Clock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Single authoritative clock. Period classification, month ranges and day-of-month
 * extraction all read the zone from here.
 */
@Configuration
public class ClockConfig {

    private static final Logger log = LoggerFactory.getLogger(ClockConfig.class);

    @Bean
    public Clock clock(CostsProperties properties) {
        Clock clock = Clock.system(properties.report().zoneId());
        log.info("Report clock pinned to zone {}", clock.getZone());
        return clock;
    }
}
