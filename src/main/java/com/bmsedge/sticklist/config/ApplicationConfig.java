package com.bmsedge.sticklist.config;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.time.ZoneId;

@Configuration
@EnableConfigurationProperties(StickListProperties.class)
public class ApplicationConfig {

    /**
     * Clock for dating generated files, in the configured output zone
     */
    @Bean
    public Clock outputClock(StickListProperties properties) {
        return Clock.system(ZoneId.of(properties.getOutputZone()));
    }
}
