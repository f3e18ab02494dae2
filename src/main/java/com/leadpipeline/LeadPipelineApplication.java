package com.leadpipeline;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class LeadPipelineApplication {

    public static void main(String[] args) {
        SpringApplication.run(LeadPipelineApplication.class, args);
    }
}
