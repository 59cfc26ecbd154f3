package com.chicu.featurelab;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication(scanBasePackages = "com.chicu.featurelab")
public class FeatureLabApplication {

    public static void main(String[] args) {
        SpringApplication.run(FeatureLabApplication.class, args);
    }
}
