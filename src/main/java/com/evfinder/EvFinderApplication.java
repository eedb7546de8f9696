package com.evfinder;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Main Spring Boot application for the value-bet finder.
 */
@SpringBootApplication
public class EvFinderApplication {

    public static void main(String[] args) {
        SpringApplication.run(EvFinderApplication.class, args);
    }
}
