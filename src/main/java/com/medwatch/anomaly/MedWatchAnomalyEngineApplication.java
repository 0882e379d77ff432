package com.medwatch.anomaly;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableAsync;

@SpringBootApplication
@EnableAsync
public class MedWatchAnomalyEngineApplication {

    public static void main(String[] args) {
        SpringApplication.run(MedWatchAnomalyEngineApplication.class, args);
    }
}
