package com.bizplanner.orchestrator;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class BusinessPlannerApplication {

    public static void main(String[] args) {
        SpringApplication.run(BusinessPlannerApplication.class, args);
    }
}
