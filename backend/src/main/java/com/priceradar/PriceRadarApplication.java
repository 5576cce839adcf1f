package com.priceradar;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class PriceRadarApplication {

    public static void main(String[] args) {
        SpringApplication.run(PriceRadarApplication.class, args);
    }
}
