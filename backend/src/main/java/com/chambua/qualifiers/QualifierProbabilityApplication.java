package com.chambua.qualifiers;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class QualifierProbabilityApplication {
    public static void main(String[] args) {
        SpringApplication.run(QualifierProbabilityApplication.class, args);
    }
}
