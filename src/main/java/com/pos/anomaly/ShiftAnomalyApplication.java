package com.pos.anomaly;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class ShiftAnomalyApplication {

    public static void main(String[] args) {
        SpringApplication.run(ShiftAnomalyApplication.class, args);
    }
}
