package com.codexa.ranking;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class CodexaRankingApplication {
    public static void main(String[] args) {
        SpringApplication.run(CodexaRankingApplication.class, args);
    }
}
