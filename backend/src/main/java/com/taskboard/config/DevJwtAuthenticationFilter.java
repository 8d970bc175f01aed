package com.taskboard.config;

import com.taskboard.user.domain.User;
import com.taskboard.user.service.UserService;
import com.taskboard.util.DevJwtUtil;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.security.authentication.BadCredentialsException;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.security.web.AuthenticationEntryPoint;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.util.Collections;

/**
 * Authenticates dev-profile requests from an HS256 token issued by {@code /api/auth/dev/login}.
 * <p>
 * No header: the request continues anonymously. A bearer token that fails verification is
 * rejected here with 401 instead of falling through as anonymous.
 */
@Slf4j
@RequiredArgsConstructor
public class DevJwtAuthenticationFilter extends OncePerRequestFilter {

    private static final String BEARER_PREFIX = "Bearer ";

    private final DevJwtUtil devJwtUtil;
    private final UserService userService;
    private final AuthenticationEntryPoint authenticationEntryPoint;

    @Override
    protected void doFilterInternal(HttpServletRequest request, HttpServletResponse response, FilterChain filterChain)
            throws ServletException, IOException {

        String header = request.getHeader("Authorization");
        if (header == null || !header.startsWith(BEARER_PREFIX)) {
            filterChain.doFilter(request, response);
            return;
        }

        String token = header.substring(BEARER_PREFIX.length());
        if (!devJwtUtil.validateToken(token)) {
            log.warn("Rejected dev token for {} {}", request.getMethod(), request.getRequestURI());
            SecurityContextHolder.clearContext();
            authenticationEntryPoint.commence(request, response, new BadCredentialsException("Invalid dev token"));
            return;
        }

        User user = userService.findOrCreateDevUser(devJwtUtil.extractUsername(token));
        UsernamePasswordAuthenticationToken authentication =
                new UsernamePasswordAuthenticationToken(user, null, Collections.emptyList());
        SecurityContextHolder.getContext().setAuthentication(authentication);

        filterChain.doFilter(request, response);
    }
}
