package com.pokerpulse.enrichment;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class PokerPulseApplication {
    public static void main(String[] args) {
        SpringApplication.run(PokerPulseApplication.class, args);
    }
}
