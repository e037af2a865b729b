package com.dispatch.gateway;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication(scanBasePackages = "com.dispatch")
public class DispatchApp {

    public static void main(String[] args) {
        SpringApplication.run(DispatchApp.class, args);
    }
}
