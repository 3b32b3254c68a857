package com.analyzemyteam.timelinesync.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * Wall-clock source for ingest timestamps, debounce windows and heartbeat deadlines.
 * Tests substitute a controllable clock.
 */
@Configuration
public class ClockConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
