package com.cinegraph.collab;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
@EnableConfigurationProperties
public class CollabGraphApplication {

    public static void main(String[] args) {
        SpringApplication.run(CollabGraphApplication.class, args);
    }
}
