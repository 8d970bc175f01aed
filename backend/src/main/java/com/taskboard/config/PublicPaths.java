package com.taskboard.config;

/**
 * Paths reachable without a token, shared by the dev and production filter chains.
 */
final class PublicPaths {

    static final String[] ALWAYS = {
            "/", "/health", "/api-docs/**", "/swagger-ui/**", "/swagger-ui.html",
            "/actuator/**",
            // accept page looks the invitation up before the invitee signs in
            "/api/workspaces/invite-info/**"
    };

    static final String[] DEV_ONLY = {
            "/api/auth/dev/**"
    };

    private PublicPaths() {
    }
}
