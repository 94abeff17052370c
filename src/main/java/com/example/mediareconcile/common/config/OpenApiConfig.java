package com.example.mediareconcile.common.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Contact;
import io.swagger.v3.oas.models.info.Info;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class OpenApiConfig {

    @Bean
    public OpenAPI mediaReconcileOpenApi() {
        return new OpenAPI()
                .info(new Info()
                        .title("Media Reconcile API")
                        .description("Format completeness and catalog matching for the local media library")
                        .version("v1")
                        .contact(new Contact().name("media-reconcile")));
    }
}
