package com.flavorsnap.backend;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class FlavorSnapApplication {

    public static void main(String[] args) {
        SpringApplication.run(FlavorSnapApplication.class, args);
    }
}
