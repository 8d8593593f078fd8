package com.ex.webstats;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class WebstatsApplication {
    public static void main(String[] args) {
        SpringApplication.run(WebstatsApplication.class, args);
    }
}
