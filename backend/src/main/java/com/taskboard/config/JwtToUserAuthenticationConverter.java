package com.taskboard.config;

import com.taskboard.user.domain.User;
import com.taskboard.user.service.UserService;
import com.taskboard.util.JwtUtils;
import lombok.RequiredArgsConstructor;
import org.springframework.core.convert.converter.Converter;
import org.springframework.security.authentication.AbstractAuthenticationToken;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.GrantedAuthority;
import org.springframework.security.core.authority.SimpleGrantedAuthority;
import org.springframework.security.oauth2.jwt.Jwt;
import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.Collections;
import java.util.stream.Collectors;

/**
 * Converts JWT to Authentication with User entity as principal.
 * The user is registered from the token claims on first sight, so
 * controllers can use @AuthenticationPrincipal User directly.
 */
@Component
@RequiredArgsConstructor
public class JwtToUserAuthenticationConverter implements Converter<Jwt, AbstractAuthenticationToken> {

    private final UserService userService;

    @Override
    public AbstractAuthenticationToken convert(Jwt jwt) {
        JwtUtils.UserInfo info = JwtUtils.extractUserInfo(jwt);
        User user = userService.findOrCreateUser(info.authUserId(), info.email(), info.name());

        return new UsernamePasswordAuthenticationToken(user, jwt, extractAuthorities(jwt));
    }

    private Collection<GrantedAuthority> extractAuthorities(Jwt jwt) {
        Collection<String> authorityClaims = jwt.getClaimAsStringList("authorities");
        if (authorityClaims != null) {
            return authorityClaims.stream()
                    .map(SimpleGrantedAuthority::new)
                    .collect(Collectors.toList());
        }
        return Collections.emptyList();
    }
}
