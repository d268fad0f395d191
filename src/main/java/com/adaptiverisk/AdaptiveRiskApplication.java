package com.adaptiverisk;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class AdaptiveRiskApplication {

    public static void main(String[] args) {
        SpringApplication.run(AdaptiveRiskApplication.class, args);
    }
}
