package com.chatrelay.server.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
public class RelayConfig {

    /**
     * Source of the server timestamps stamped on every relayed envelope.
     */
    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
