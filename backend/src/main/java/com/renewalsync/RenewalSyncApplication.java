package com.renewalsync;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class RenewalSyncApplication {

    public static void main(String[] args) {
        SpringApplication.run(RenewalSyncApplication.class, args);
    }
}
