package com.bank.billshock;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class BillShockDetectorApplication {

    public static void main(String[] args) {
        SpringApplication.run(BillShockDetectorApplication.class, args);
    }
}
