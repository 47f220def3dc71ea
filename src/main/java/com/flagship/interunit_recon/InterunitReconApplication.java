package com.flagship.interunit_recon;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class InterunitReconApplication {

    public static void main(String[] args) {
        SpringApplication.run(InterunitReconApplication.class, args);
    }
}
