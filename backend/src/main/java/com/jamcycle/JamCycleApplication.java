package com.jamcycle;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class JamCycleApplication {
    public static void main(String[] args) {
        SpringApplication.run(JamCycleApplication.class, args);
    }
}
