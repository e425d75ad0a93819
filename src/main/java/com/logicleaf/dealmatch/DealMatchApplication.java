package com.logicleaf.dealmatch;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class DealMatchApplication {

    public static void main(String[] args) {
        SpringApplication.run(DealMatchApplication.class, args);
    }
}
