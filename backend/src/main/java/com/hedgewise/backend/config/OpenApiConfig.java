package com.hedgewise.backend.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class OpenApiConfig {

    @Bean
    public OpenAPI hedgewiseOpenApi() {
        return new OpenAPI()
                .info(new Info()
                        .title("Hedgewise Currency Risk API")
                        .description("Currency risk assessment and hedge strategy recommendations")
                        .version("1.0"));
    }
}
