package com.ella.forecasting.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Contact;
import io.swagger.v3.oas.models.info.Info;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class OpenApiConfig {

    @Bean
    public OpenAPI forecastingOpenAPI() {
        return new OpenAPI()
                .info(new Info()
                        .title("ELLA Forecasting API")
                        .description("Previsão de gastos, alertas de orçamento e acompanhamento de acurácia.")
                        .version("v1")
                        .contact(new Contact()
                                .name("ELLA")
                                .email("support@ella.app")
                        )
                );
    }
}
