package com.statecheck;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class StatecheckApplication {
    public static void main(String[] args) {
        SpringApplication.run(StatecheckApplication.class, args);
    }
}
