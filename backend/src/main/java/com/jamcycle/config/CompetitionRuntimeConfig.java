package com.jamcycle.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.util.Random;

@Configuration
public class CompetitionRuntimeConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    /**
     * Source of randomness for face-off tie breaks and theme proposals; tests pass a seeded instance.
     */
    @Bean
    public Random competitionRandom() {
        return new Random();
    }
}
