package com.example.FundScout;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class FundScoutApplication {

    public static void main(String[] args) {
        SpringApplication.run(FundScoutApplication.class, args);
    }
}
