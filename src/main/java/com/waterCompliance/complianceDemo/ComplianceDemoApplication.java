package com.waterCompliance.complianceDemo;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class ComplianceDemoApplication {

    public static void main(String[] args) {
        SpringApplication.run(ComplianceDemoApplication.class, args);
    }
}
