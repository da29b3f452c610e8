package com.veriheal;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class VeriHealApplication {

    public static void main(String[] args) {
        SpringApplication.run(VeriHealApplication.class, args);
    }
}
