package com.keypoints;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class SiftApplication {

    public static void main(String[] args) {
        SpringApplication.run(SiftApplication.class, args);
    }
}
