package com.chs.calculator;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * springdoc serves the generated document at {@code /openapi.json} and Swagger UI at {@code /docs}.
 */
@Configuration
public class ApiDocsConfig {

    @Bean
    public OpenAPI calculatorOpenApi(@Value("${spring.application.name}") String serviceName) {
        return new OpenAPI().info(new Info()
                .title(serviceName)
                .description("Stateless arithmetic on two numbers")
                .version("0.0.1"));
    }
}
