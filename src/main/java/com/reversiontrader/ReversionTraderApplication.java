package com.reversiontrader;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class ReversionTraderApplication {

    public static void main(String[] args) {
        SpringApplication.run(ReversionTraderApplication.class, args);
    }
}
