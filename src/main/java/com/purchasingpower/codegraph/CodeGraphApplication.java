package com.purchasingpower.codegraph;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableAsync;

@SpringBootApplication
@EnableAsync
public class CodeGraphApplication {

    public static void main(String[] args) {
        SpringApplication.run(CodeGraphApplication.class, args);
    }
}
