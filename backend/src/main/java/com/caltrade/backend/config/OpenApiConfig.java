package com.caltrade.backend.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class OpenApiConfig {

    @Bean
    public OpenAPI calendarTradeOpenApi() {
        return new OpenAPI()
                .info(new Info()
                        .title("Calendar Trade Bridge API")
                        .description("Calendar-driven trade dispatch with duplicate suppression")
                        .version("1.0"));
    }
}
