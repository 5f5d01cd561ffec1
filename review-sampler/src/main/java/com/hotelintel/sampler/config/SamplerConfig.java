package com.hotelintel.sampler.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
public class SamplerConfig {

    @Bean
    public Clock clock() {
        return Clock.systemDefaultZone();
    }
}
