package com.debateplatform.engine;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class DebateEngineApplication {

    public static void main(String[] args) {
        SpringApplication.run(DebateEngineApplication.class, args);
    }
}
