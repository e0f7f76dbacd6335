package com.helix.scopecheck;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableAsync;

@SpringBootApplication
@EnableAsync
public class ScopeCheckApplication {

    public static void main(String[] args) {
        SpringApplication.run(ScopeCheckApplication.class, args);
    }
}
