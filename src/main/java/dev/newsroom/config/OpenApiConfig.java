package dev.newsroom.config;

import io.swagger.v3.oas.models.Components;
import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.security.SecurityRequirement;
import io.swagger.v3.oas.models.security.SecurityScheme;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration(proxyBeanMethods = false)
public class OpenApiConfig {

    private static final String BEARER_SCHEME = "bearerAuth";

    @Value("${app.version:1.0.0}")
    private String appVersion;

    @Bean
    public OpenAPI newsroomOpenAPI() {
        return new OpenAPI()
                .info(new Info()
                        .title("Newsroom API")
                        .description("""
                                Articles, newsletters, publishing houses and reader subscriptions.

                                Authenticated calls carry `Authorization: Bearer <token>`;
                                obtain a token from `/api/v1/auth/login`.
                                """)
                        .version(appVersion))
                .addSecurityItem(new SecurityRequirement().addList(BEARER_SCHEME))
                .components(new Components()
                        .addSecuritySchemes(BEARER_SCHEME, new SecurityScheme()
                                .name(BEARER_SCHEME)
                                .type(SecurityScheme.Type.HTTP)
                                .scheme("bearer")
                                .bearerFormat("JWT")));
    }
}
