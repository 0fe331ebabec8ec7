package com.gotable.common.security;

import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * 인증된 사용자 ID를 받을 {@code Long} 핸들러 파라미터 표시.
 * 인증 정보가 없으면 {@link LoginUserArgumentResolver}가 401로 거절한다.
 */
@Target(ElementType.PARAMETER)
@Retention(RetentionPolicy.RUNTIME)
public @interface LoginUser {
}
