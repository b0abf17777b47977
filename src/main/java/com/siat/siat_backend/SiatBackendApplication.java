package com.siat.siat_backend;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableAsync;

@SpringBootApplication
@EnableAsync
public class SiatBackendApplication {

    public static void main(String[] args) {
        SpringApplication.run(SiatBackendApplication.class, args);
    }
}
