package com.pizzaindex.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.servers.Server;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;

/**
 * OpenAPI documentation.
 *
 * Swagger UI: http://localhost:8000/swagger-ui/index.html
 * OpenAPI JSON: http://localhost:8000/v3/api-docs
 */
@Configuration
public class OpenApiConfig {

    @Bean
    public OpenAPI pizzaIndexOpenAPI(@Value("${server.port:8000}") int port) {
        return new OpenAPI()
                .info(new Info()
                        .title("Pentagon Pizza Index API")
                        .description("""
                                Real-time pizza demand index around the Pentagon.

                                **Features:**
                                - Live index with change against the previous minute, hour or day
                                - Index series over a configurable window
                                - Raw rows and statistics per restaurant
                                - 60 second response cache for index endpoints
                                """)
                        .version("1.0.0"))
                .servers(List.of(
                        new Server()
                                .url("http://localhost:" + port)
                                .description("Local Development Server")
                ));
    }
}
