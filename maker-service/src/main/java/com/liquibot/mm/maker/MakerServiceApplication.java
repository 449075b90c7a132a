package com.liquibot.mm.maker;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication(scanBasePackages = "com.liquibot.mm")
@EnableScheduling
public class MakerServiceApplication {

    public static void main(String[] args) {
        SpringApplication.run(MakerServiceApplication.class, args);
    }
}
