package com.gotable.user.service;

import com.gotable.common.exception.BusinessException;
import com.gotable.common.exception.ErrorCode;
import com.gotable.common.security.JwtTokenProvider;
import com.gotable.user.dto.AuthResponse;
import com.gotable.user.dto.LoginRequest;
import com.gotable.user.dto.RegisterRequest;
import com.gotable.user.dto.UserResponse;
import com.gotable.user.entity.User;
import com.gotable.user.repository.UserRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * 회원가입, 로그인, 인증 사용자 조회.
 */
@Slf4j
@Service
@RequiredArgsConstructor
@Transactional(readOnly = true)
public class UserService {

    private final UserRepository userRepository;
    private final PasswordEncoder passwordEncoder;
    private final JwtTokenProvider jwtTokenProvider;

    /** 회원가입 - 중복 이메일이면 DUPLICATE_EMAIL, 성공 시 바로 토큰 발급 */
    @Transactional
    public AuthResponse register(RegisterRequest request) {
        if (userRepository.existsByEmail(request.email())) {
            throw new BusinessException(ErrorCode.DUPLICATE_EMAIL);
        }

        User user = User.builder()
                .email(request.email())
                .passwordHash(passwordEncoder.encode(request.password()))
                .name(request.name())
                .build();

        try {
            user = userRepository.saveAndFlush(user);
        } catch (DataIntegrityViolationException e) {
            // 같은 이메일로 동시에 가입한 요청이 유니크 인덱스를 먼저 차지함
            throw new BusinessException(ErrorCode.DUPLICATE_EMAIL);
        }

        log.info("User registered: userId={}", user.getId());
        return AuthResponse.bearer(UserResponse.from(user), jwtTokenProvider.createToken(user.getId()));
    }

    /** 로그인 - 없는 이메일과 틀린 비밀번호를 같은 에러로 응답 */
    public AuthResponse login(LoginRequest request) {
        User user = userRepository.findByEmail(request.email())
                .filter(candidate -> passwordEncoder.matches(request.password(), candidate.getPasswordHash()))
                .orElseThrow(() -> new BusinessException(ErrorCode.INVALID_CREDENTIALS));

        return AuthResponse.bearer(UserResponse.from(user), jwtTokenProvider.createToken(user.getId()));
    }

    /**
     * 검증된 토큰의 사용자를 조회한다. 사용자가 삭제됐으면 잘못된 토큰과 같이 UNAUTHORIZED.
     */
    public User getAuthenticatedUser(Long userId) {
        return userRepository.findById(userId)
                .orElseThrow(() -> new BusinessException(ErrorCode.UNAUTHORIZED, "User no longer exists"));
    }
}
