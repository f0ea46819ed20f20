package com.coderelay.engine;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class CodeRelayApplication {

    public static void main(String[] args) {
        SpringApplication.run(CodeRelayApplication.class, args);
    }
}
