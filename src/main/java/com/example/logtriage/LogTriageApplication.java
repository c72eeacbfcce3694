package com.example.logtriage;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class LogTriageApplication {

    public static void main(String[] args) {
        SpringApplication.run(LogTriageApplication.class, args);
    }
}
