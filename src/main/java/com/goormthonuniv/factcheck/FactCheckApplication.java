package com.goormthonuniv.factcheck;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class FactCheckApplication {
    public static void main(String[] args) {
        SpringApplication.run(FactCheckApplication.class, args);
    }
}
