package com.ppm.backend;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class PpmBackendApplication {
    public static void main(String[] args) {
        SpringApplication.run(PpmBackendApplication.class, args);
    }
}
