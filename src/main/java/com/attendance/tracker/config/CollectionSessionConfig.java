package com.attendance.tracker.config;

import com.attendance.tracker.core.CollectionSessionRegistry;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class CollectionSessionConfig {

    @Bean
    public CollectionSessionRegistry collectionSessionRegistry() {
        return new CollectionSessionRegistry();
    }
}
