package com.example.AssessRec.config;

import io.swagger.v3.oas.annotations.OpenAPIDefinition;
import io.swagger.v3.oas.annotations.info.Info;
import org.springframework.context.annotation.Configuration;

@Configuration
@OpenAPIDefinition(
        info = @Info(
                title = "AssessRec API",
                version = "v1",
                description = "Assessment retrieval, recommendation and Mean Recall@K evaluation"
        )
)
public class OpenApiConfig {
}
