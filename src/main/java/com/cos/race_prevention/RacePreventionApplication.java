package com.cos.race_prevention;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class RacePreventionApplication {

    public static void main(String[] args) {
        SpringApplication.run(RacePreventionApplication.class, args);
    }
}
