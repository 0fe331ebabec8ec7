package com.gotable.user.service;

import com.gotable.common.exception.BusinessException;
import com.gotable.common.exception.ErrorCode;
import com.gotable.common.security.JwtTokenProvider;
import com.gotable.support.TestFixtures;
import com.gotable.user.dto.AuthResponse;
import com.gotable.user.dto.LoginRequest;
import com.gotable.user.dto.RegisterRequest;
import com.gotable.user.entity.User;
import com.gotable.user.repository.UserRepository;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.test.util.ReflectionTestUtils;

import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.BDDMockito.given;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

@ExtendWith(MockitoExtension.class)
class UserServiceTest {

    @Mock
    private UserRepository userRepository;
    @Mock
    private PasswordEncoder passwordEncoder;
    @Mock
    private JwtTokenProvider jwtTokenProvider;

    @InjectMocks
    private UserService userService;

    @Test
    @DisplayName("회원가입 성공 - 비밀번호는 해시로 저장되고 토큰이 발급됨")
    void register_Success() {
        given(userRepository.existsByEmail("new@example.com")).willReturn(false);
        given(passwordEncoder.encode("password123")).willReturn("$2a$10$encoded");
        given(userRepository.saveAndFlush(any(User.class))).willAnswer(inv -> {
            User saved = inv.getArgument(0);
            ReflectionTestUtils.setField(saved, "id", 7L);
            return saved;
        });
        given(jwtTokenProvider.createToken(7L)).willReturn("token");

        AuthResponse response = userService.register(
                new RegisterRequest("new@example.com", "password123", "New Guest"));

        assertThat(response.user().id()).isEqualTo(7L);
        assertThat(response.user().email()).isEqualTo("new@example.com");
        assertThat(response.accessToken()).isEqualTo("token");
        assertThat(response.tokenType()).isEqualTo("bearer");
        verify(userRepository).saveAndFlush(argThat(
                user -> user.getPasswordHash().equals("$2a$10$encoded")));
    }

    @Test
    @DisplayName("이미 등록된 이메일이면 DUPLICATE_EMAIL, 저장하지 않음")
    void register_DuplicateEmail() {
        given(userRepository.existsByEmail("taken@example.com")).willReturn(true);

        assertThatThrownBy(() -> userService.register(
                new RegisterRequest("taken@example.com", "password123", "Guest")))
                .isInstanceOf(BusinessException.class)
                .hasFieldOrPropertyWithValue("errorCode", ErrorCode.DUPLICATE_EMAIL);

        verify(userRepository, never()).saveAndFlush(any());
    }

    @Test
    @DisplayName("동시 가입으로 유니크 인덱스 위반 시에도 DUPLICATE_EMAIL")
    void register_ConcurrentDuplicate() {
        given(userRepository.existsByEmail("race@example.com")).willReturn(false);
        given(passwordEncoder.encode(any())).willReturn("hash");
        given(userRepository.saveAndFlush(any(User.class)))
                .willThrow(new DataIntegrityViolationException("uk_users_email"));

        assertThatThrownBy(() -> userService.register(
                new RegisterRequest("race@example.com", "password123", "Guest")))
                .isInstanceOf(BusinessException.class)
                .hasFieldOrPropertyWithValue("errorCode", ErrorCode.DUPLICATE_EMAIL);
    }

    @Test
    @DisplayName("비밀번호가 틀리면 INVALID_CREDENTIALS")
    void login_WrongPassword() {
        User user = TestFixtures.user(1L);
        given(userRepository.findByEmail(user.getEmail())).willReturn(Optional.of(user));
        given(passwordEncoder.matches("wrong-password", user.getPasswordHash())).willReturn(false);

        assertThatThrownBy(() -> userService.login(new LoginRequest(user.getEmail(), "wrong-password")))
                .isInstanceOf(BusinessException.class)
                .hasFieldOrPropertyWithValue("errorCode", ErrorCode.INVALID_CREDENTIALS);
    }

    @Test
    @DisplayName("존재하지 않는 이메일도 같은 INVALID_CREDENTIALS")
    void login_UnknownEmail() {
        given(userRepository.findByEmail("nobody@example.com")).willReturn(Optional.empty());

        assertThatThrownBy(() -> userService.login(new LoginRequest("nobody@example.com", "password123")))
                .isInstanceOf(BusinessException.class)
                .hasFieldOrPropertyWithValue("errorCode", ErrorCode.INVALID_CREDENTIALS);
    }

    @Test
    @DisplayName("로그인 성공 시 bearer 토큰 발급")
    void login_Success() {
        User user = TestFixtures.user(3L);
        given(userRepository.findByEmail(user.getEmail())).willReturn(Optional.of(user));
        given(passwordEncoder.matches("password123", user.getPasswordHash())).willReturn(true);
        given(jwtTokenProvider.createToken(3L)).willReturn("token-3");

        AuthResponse response = userService.login(new LoginRequest(user.getEmail(), "password123"));

        assertThat(response.accessToken()).isEqualTo("token-3");
        assertThat(response.user().id()).isEqualTo(3L);
    }

    @Test
    @DisplayName("토큰의 사용자가 삭제되었으면 UNAUTHORIZED")
    void getAuthenticatedUser_Deleted() {
        given(userRepository.findById(9L)).willReturn(Optional.empty());

        assertThatThrownBy(() -> userService.getAuthenticatedUser(9L))
                .isInstanceOf(BusinessException.class)
                .hasFieldOrPropertyWithValue("errorCode", ErrorCode.UNAUTHORIZED);
    }
}
