package com.taskboard.auth.controller;

import com.taskboard.auth.dto.DevLoginRequest;
import com.taskboard.auth.dto.LoginResponse;
import com.taskboard.util.DevJwtUtil;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.context.annotation.Profile;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import static com.taskboard.common.controller.ResponseHelper.ok;

/**
 * 개발용 간단 로그인 엔드포인트
 * dev 프로파일에서만 활성화됩니다.
 */
@RestController
@RequestMapping("/api/auth/dev")
@Profile("dev")
@RequiredArgsConstructor
public class DevAuthController {

    private final DevJwtUtil devJwtUtil;

    @PostMapping("/login")
    public ResponseEntity<LoginResponse> devLogin(@Valid @RequestBody DevLoginRequest request) {
        String token = devJwtUtil.generateToken(request.getUsername());

        LoginResponse response = LoginResponse.builder()
                .accessToken(token)
                .tokenType("Bearer")
                .expiresIn(DevJwtUtil.EXPIRATION_HOURS * 3600)
                .build();

        return ok(response);
    }
}
