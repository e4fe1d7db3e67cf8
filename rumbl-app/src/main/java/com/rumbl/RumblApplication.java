package com.rumbl;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class RumblApplication {

    public static void main(String[] args) {
        SpringApplication.run(RumblApplication.class, args);
    }
}
