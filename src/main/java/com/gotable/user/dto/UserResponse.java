package com.gotable.user.dto;

import com.gotable.user.entity.User;

import java.time.LocalDateTime;

/**
 * 사용자 공개 정보. 비밀번호 해시는 포함하지 않는다.
 */
public record UserResponse(Long id, String email, String name, LocalDateTime createdAt) {

    public static UserResponse from(User user) {
        return new UserResponse(user.getId(), user.getEmail(), user.getName(), user.getCreatedAt());
    }
}
