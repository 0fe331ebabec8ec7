package com.gotable.user.controller;

import com.gotable.common.dto.ApiResponse;
import com.gotable.common.security.LoginUser;
import com.gotable.user.dto.AuthResponse;
import com.gotable.user.dto.LoginRequest;
import com.gotable.user.dto.RegisterRequest;
import com.gotable.user.dto.UserResponse;
import com.gotable.user.service.UserService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.*;

/**
 * 인증 API 컨트롤러.
 *
 * <h3>API 목록</h3>
 * <ul>
 *   <li>POST /api/auth/register - 회원가입 (201, 토큰 포함)</li>
 *   <li>POST /api/auth/login - 로그인</li>
 *   <li>GET /api/auth/me - 내 정보 (인증 필요)</li>
 * </ul>
 */
@RestController
@RequestMapping("/api/auth")
@RequiredArgsConstructor
public class AuthController {

    private final UserService userService;

    @PostMapping("/register")
    @ResponseStatus(HttpStatus.CREATED)
    public ApiResponse<AuthResponse> register(@Valid @RequestBody RegisterRequest request) {
        return ApiResponse.ok(userService.register(request));
    }

    @PostMapping("/login")
    public ApiResponse<AuthResponse> login(@Valid @RequestBody LoginRequest request) {
        return ApiResponse.ok(userService.login(request));
    }

    @GetMapping("/me")
    public ApiResponse<UserResponse> me(@LoginUser Long userId) {
        return ApiResponse.ok(UserResponse.from(userService.getAuthenticatedUser(userId)));
    }
}
