package com.vidnyan.gae;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * GAE - Grammar Analysis Engine
 * 
 * Validates EBNF grammar text and reports structural patterns and complexity.
 */
@SpringBootApplication
public class GaeApplication {

    public static void main(String[] args) {
        SpringApplication.run(GaeApplication.class, args);
    }
}
