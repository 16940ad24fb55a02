package com.poker.tracker;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class HandTrackerApplication {

    public static void main(String[] args) {
        SpringApplication.run(HandTrackerApplication.class, args);
    }
}
