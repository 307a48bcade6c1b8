package com.example.orchestrator;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class DealerChatOrchestratorApplication {

    public static void main(String[] args) {
        SpringApplication.run(DealerChatOrchestratorApplication.class, args);
    }
}
