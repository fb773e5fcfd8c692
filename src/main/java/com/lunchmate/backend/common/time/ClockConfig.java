package com.lunchmate.backend.common.time;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.time.ZoneId;

/**
 * The single time source: every cutoff and timestamp takes "now" from here. Tests replace it with a fixed or movable Clock.
 */
@Configuration
public class ClockConfig {

    @Bean
    public Clock clock(@Value("${app.clock.zone:UTC}") String zone) {
        return Clock.system(ZoneId.of(zone));
    }
}
