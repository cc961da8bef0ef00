package com.trackly.backend.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Contact;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.servers.Server;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.servlet.config.annotation.ViewControllerRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

import java.util.List;

@Configuration
public class ApiMetadataConfig implements WebMvcConfigurer {

        @Value("${trackly.public-url:http://localhost:8080}")
        private String publicUrl;

        // short alias for the Swagger UI
        @Override
        public void addViewControllers(ViewControllerRegistry registry) {
                for (String path : List.of("/docs", "/docs/")) {
                        registry.addRedirectViewController(path, "/swagger-ui.html");
                }
        }

        @Bean
        public OpenAPI tracklyOpenAPI(
                        @Value("${catalog.terminal-label:Penn Station}") String terminal) {
                return new OpenAPI()
                                .info(new Info()
                                                .title("Trackly Track Predictions")
                                                .description("Departure track predictions for outbound trains at "
                                                                + terminal + ". Tracks are learned from the live "
                                                                + "departures feed; treat them as guidance until "
                                                                + "the railroad posts the official track.")
                                                .version("v1")
                                                .contact(new Contact().name("Trackly")))
                                .servers(List.of(new Server().url(publicUrl).description("Trackly backend")));
        }
}
