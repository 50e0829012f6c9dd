package com.bayesai.server;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class BayesAiServerApplication {

    public static void main(String[] args) {
        SpringApplication.run(BayesAiServerApplication.class, args);
    }
}
