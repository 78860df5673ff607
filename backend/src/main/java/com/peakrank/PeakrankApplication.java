package com.peakrank;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class PeakrankApplication {
    public static void main(String[] args) {
        SpringApplication.run(PeakrankApplication.class, args);
    }
}
