package com.spreadengine;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class SpreadEngineApplication {

    public static void main(String[] args) {
        SpringApplication.run(SpreadEngineApplication.class, args);
    }
}
