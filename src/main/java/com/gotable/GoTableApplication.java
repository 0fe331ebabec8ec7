package com.gotable;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class GoTableApplication {

    public static void main(String[] args) {
        SpringApplication.run(GoTableApplication.class, args);
    }
}
