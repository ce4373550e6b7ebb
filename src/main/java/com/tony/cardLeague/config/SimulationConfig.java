package com.tony.cardLeague.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.security.SecureRandom;
import java.util.Random;

@Configuration
public class SimulationConfig {

    // Source aléatoire du moteur de match. Les tests injectent un Random à graine fixe.
    @Bean
    public Random matchRandom() {
        return new SecureRandom();
    }
}
