package com.lunchmate.backend;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class LunchMateApplication {

    public static void main(String[] args) {
        SpringApplication.run(LunchMateApplication.class, args);
    }
}
