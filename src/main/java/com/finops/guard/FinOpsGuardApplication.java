package com.finops.guard;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class FinOpsGuardApplication {

    public static void main(String[] args) {
        SpringApplication.run(FinOpsGuardApplication.class, args);
    }
}
