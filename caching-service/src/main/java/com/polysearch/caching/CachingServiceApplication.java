package com.polysearch.caching;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class CachingServiceApplication {
    public static void main(String[] args) {
        SpringApplication.run(CachingServiceApplication.class, args);
    }
}
