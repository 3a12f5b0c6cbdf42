package com.assethealth.anomaly;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class AbnormalityScoringApplication {

    public static void main(String[] args) {
        SpringApplication.run(AbnormalityScoringApplication.class, args);
    }
}
