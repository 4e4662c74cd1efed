package com.llmrouter;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.data.r2dbc.repository.config.EnableR2dbcRepositories;

/**
 * LLM Router Application
 *
 * Authenticating gateway in front of OpenAI-compatible LLM providers,
 * built with Spring Boot WebFlux.
 */
@SpringBootApplication
@EnableR2dbcRepositories
public class LlmRouterApplication {

    public static void main(String[] args) {
        SpringApplication.run(LlmRouterApplication.class, args);
    }

}
