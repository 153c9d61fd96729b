package com.fxhedge.config;

import com.fxhedge.core.engine.RandomStreamFactory;
import org.apache.commons.math3.random.Well19937c;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class SimulationConfig {

    @Bean
    public RandomStreamFactory randomStreamFactory() {
        return Well19937c::new;
    }
}
