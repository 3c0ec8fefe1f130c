package com.rackspace.metrilake.app.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Profile;

import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;

@Configuration
@Profile("collect")
public class ScheduledExecutorConfig {

    @Bean
    public ScheduledExecutorService collectionExecutor() {
        return Executors.newSingleThreadScheduledExecutor();
    }
}
