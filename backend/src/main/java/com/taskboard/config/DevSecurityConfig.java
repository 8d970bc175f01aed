package com.taskboard.config;

import com.taskboard.user.service.UserService;
import com.taskboard.util.DevJwtUtil;
import lombok.RequiredArgsConstructor;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Profile;
import org.springframework.security.config.annotation.web.builders.HttpSecurity;
import org.springframework.security.config.annotation.web.configuration.EnableWebSecurity;
import org.springframework.security.config.http.SessionCreationPolicy;
import org.springframework.security.web.SecurityFilterChain;
import org.springframework.security.web.authentication.UsernamePasswordAuthenticationFilter;
import org.springframework.web.cors.CorsConfigurationSource;

/**
 * Local-only chain: tokens come from the dev login endpoint instead of the identity provider,
 * and users are created on first request.
 */
@Configuration
@EnableWebSecurity
@Profile("dev")
@RequiredArgsConstructor
public class DevSecurityConfig {

    private final CorsConfigurationSource corsConfigurationSource;
    private final JsonAuthenticationEntryPoint authenticationEntryPoint;

    @Bean
    public SecurityFilterChain devFilterChain(HttpSecurity http, DevJwtUtil devJwtUtil,
                                              UserService userService) throws Exception {
        // built here, not as a bean, so Boot does not also register it on the servlet chain
        DevJwtAuthenticationFilter devJwtFilter =
                new DevJwtAuthenticationFilter(devJwtUtil, userService, authenticationEntryPoint);

        http
            .cors(cors -> cors.configurationSource(corsConfigurationSource))
            .csrf(csrf -> csrf.disable())
            .sessionManagement(session -> session
                 .sessionCreationPolicy(SessionCreationPolicy.STATELESS)
            )
            .exceptionHandling(ex -> ex.authenticationEntryPoint(authenticationEntryPoint))
            .addFilterBefore(devJwtFilter, UsernamePasswordAuthenticationFilter.class)
            .authorizeHttpRequests(auth -> auth
                .requestMatchers(PublicPaths.ALWAYS).permitAll()
                .requestMatchers(PublicPaths.DEV_ONLY).permitAll()
                .anyRequest().authenticated()
            );

        return http.build();
    }
}
