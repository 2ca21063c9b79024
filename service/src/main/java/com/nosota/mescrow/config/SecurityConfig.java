package com.nosota.mescrow.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.env.Environment;
import org.springframework.core.env.Profiles;
import org.springframework.security.config.annotation.web.builders.HttpSecurity;
import org.springframework.security.config.annotation.web.configuration.EnableWebSecurity;
import org.springframework.security.config.annotation.web.configurers.AbstractHttpConfigurer;
import org.springframework.security.config.http.SessionCreationPolicy;
import org.springframework.security.web.SecurityFilterChain;

/**
 * The service sits behind the gateway, which authenticates users and forwards
 * {@code X-User-Id} / {@code X-User-Role}. Only the finance, contract and milestone
 * endpoints are reachable; the OpenAPI docs are served under the {@code dev} profile only.
 */
@Configuration
@EnableWebSecurity
public class SecurityConfig {

    private static final String[] API_PATHS = {
            "/api/v1/finance/**",
            "/api/v1/contracts/**",
            "/api/v1/milestones/**",
            "/error"
    };

    private final Environment environment;
    private final String apiDocsPath;
    private final String swaggerUiPath;

    public SecurityConfig(Environment environment,
                          @Value("${springdoc.api-docs.path:/v3/api-docs}") String apiDocsPath,
                          @Value("${springdoc.swagger-ui.path:/swagger-ui.html}") String swaggerUiPath) {
        this.environment = environment;
        this.apiDocsPath = apiDocsPath;
        this.swaggerUiPath = swaggerUiPath;
    }

    @Bean
    public SecurityFilterChain securityFilterChain(HttpSecurity http) throws Exception {
        boolean docsEnabled = environment.acceptsProfiles(Profiles.of("dev"));
        return http
                .authorizeHttpRequests(auth -> {
                    auth.requestMatchers(API_PATHS).permitAll();
                    if (docsEnabled) {
                        auth.requestMatchers(apiDocsPath, apiDocsPath + "/**", swaggerUiPath, "/swagger-ui/**")
                                .permitAll();
                    }
                    auth.anyRequest().denyAll();
                })
                .sessionManagement(session -> session.sessionCreationPolicy(SessionCreationPolicy.STATELESS))
                .csrf(AbstractHttpConfigurer::disable)
                .build();
    }
}
