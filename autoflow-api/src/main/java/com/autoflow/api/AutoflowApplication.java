package com.autoflow.api;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Main application entry point for Autoflow.
 */
@SpringBootApplication
@EnableScheduling
public class AutoflowApplication {

    public static void main(String[] args) {
        SpringApplication.run(AutoflowApplication.class, args);
    }
}
