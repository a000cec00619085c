package com.heist.backend.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class OpenApiConfig {

    @Bean
    public OpenAPI heistOpenApi() {
        return new OpenAPI()
                .info(new Info()
                        .title("Heist Engine API")
                        .description("Read-only pipeline status plus the message ingestion webhook")
                        .version("1.0"));
    }
}
