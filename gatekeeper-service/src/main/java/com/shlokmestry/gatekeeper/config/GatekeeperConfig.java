package com.shlokmestry.gatekeeper.config;

import java.security.SecureRandom;
import java.time.Clock;
import java.util.Random;

import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class GatekeeperConfig {

    @Bean
    Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    @Qualifier("tokenRandom")
    Random tokenRandom() {
        return new SecureRandom();
    }
}
