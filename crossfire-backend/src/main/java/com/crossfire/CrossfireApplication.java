package com.crossfire;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class CrossfireApplication {

    public static void main(String[] args) {
        SpringApplication.run(CrossfireApplication.class, args);
    }
}
