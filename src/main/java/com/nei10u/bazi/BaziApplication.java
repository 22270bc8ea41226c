package com.nei10u.bazi;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class BaziApplication {

    public static void main(String[] args) {
        SpringApplication.run(BaziApplication.class, args);
    }
}
