package com.mesh.registry.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
public class RegistryConfig {

    @Bean
    public Clock registryClock() {
        return Clock.systemUTC();
    }
}
