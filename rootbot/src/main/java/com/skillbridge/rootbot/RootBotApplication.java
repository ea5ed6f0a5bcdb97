package com.skillbridge.rootbot;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class RootBotApplication {

    public static void main(String[] args) {
        SpringApplication.run(RootBotApplication.class, args);
    }
}
