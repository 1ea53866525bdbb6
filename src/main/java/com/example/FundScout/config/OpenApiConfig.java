package com.example.FundScout.config;

import io.swagger.v3.oas.annotations.OpenAPIDefinition;
import io.swagger.v3.oas.annotations.info.Info;
import org.springframework.context.annotation.Configuration;

@Configuration
@OpenAPIDefinition(
        info = @Info(
                title = "FundScout API",
                version = "v1",
                description = "Funding program shortlisting: hybrid retrieval, ranking and grounded LLM selection"
        )
)
public class OpenApiConfig {
}
