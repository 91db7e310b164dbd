package com.nationrank.api.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.servers.Server;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;

@Configuration
public class OpenApiConfig {

    @Bean
    public OpenAPI rankingOpenApi() {
        return new OpenAPI()
                .info(new Info()
                        .title("Nation Leaderboard API")
                        .version("1.0.0")
                        .description("Confidence-corrected nation and player leaderboards, party teams, communities and frequent pairs computed from the match store."))
                .servers(List.of(
                        new Server().url("http://localhost:8080").description("Local Development")
                ));
    }
}
