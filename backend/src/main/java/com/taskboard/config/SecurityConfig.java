package com.taskboard.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Profile;
import org.springframework.security.config.annotation.web.builders.HttpSecurity;
import org.springframework.security.config.annotation.web.configuration.EnableWebSecurity;
import org.springframework.security.config.http.SessionCreationPolicy;
import org.springframework.security.web.SecurityFilterChain;
import org.springframework.web.cors.CorsConfigurationSource;

/**
 * Production chain: the service is an OAuth2 resource server and trusts tokens signed by the
 * identity provider's JWK set. Users are registered from the token on first request.
 */
@Configuration
@EnableWebSecurity
@Profile("!dev")
public class SecurityConfig {

    private final CorsConfigurationSource corsConfigurationSource;
    private final JwtToUserAuthenticationConverter jwtToUserAuthenticationConverter;
    private final JsonAuthenticationEntryPoint authenticationEntryPoint;
    private final String jwkSetUri;

    public SecurityConfig(CorsConfigurationSource corsConfigurationSource,
                          JwtToUserAuthenticationConverter jwtToUserAuthenticationConverter,
                          JsonAuthenticationEntryPoint authenticationEntryPoint,
                          @Value("${spring.security.oauth2.resourceserver.jwt.jwk-set-uri}") String jwkSetUri) {
        this.corsConfigurationSource = corsConfigurationSource;
        this.jwtToUserAuthenticationConverter = jwtToUserAuthenticationConverter;
        this.authenticationEntryPoint = authenticationEntryPoint;
        this.jwkSetUri = jwkSetUri;
    }

    @Bean
    public SecurityFilterChain filterChain(HttpSecurity http) throws Exception {
        http
            .cors(cors -> cors.configurationSource(corsConfigurationSource))
            .csrf(csrf -> csrf.disable())
            .sessionManagement(session -> session
                 .sessionCreationPolicy(SessionCreationPolicy.STATELESS)
            )
            .exceptionHandling(ex -> ex.authenticationEntryPoint(authenticationEntryPoint))
            .oauth2ResourceServer(oauth2 -> oauth2
                .authenticationEntryPoint(authenticationEntryPoint)
                .jwt(jwt -> jwt
                    .jwkSetUri(jwkSetUri)
                    .jwtAuthenticationConverter(jwtToUserAuthenticationConverter)
                )
            )
            .authorizeHttpRequests(auth -> auth
                .requestMatchers(PublicPaths.ALWAYS).permitAll()
                .anyRequest().authenticated()
            );

        return http.build();
    }
}
