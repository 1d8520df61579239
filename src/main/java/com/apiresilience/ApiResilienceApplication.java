package com.apiresilience;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class ApiResilienceApplication {
    public static void main(String[] args) {
        SpringApplication.run(ApiResilienceApplication.class, args);
    }
}
