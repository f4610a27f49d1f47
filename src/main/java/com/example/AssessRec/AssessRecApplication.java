package com.example.AssessRec;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class AssessRecApplication {

    public static void main(String[] args) {
        SpringApplication.run(AssessRecApplication.class, args);
    }
}
