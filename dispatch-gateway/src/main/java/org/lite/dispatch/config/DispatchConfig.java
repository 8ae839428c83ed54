package org.lite.dispatch.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
public class DispatchConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
