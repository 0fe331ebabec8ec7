package com.gotable.common.exception;

import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.net.URI;
import java.util.stream.Collectors;

/**
 * 전역 예외 처리기 - 모든 실패를 RFC 9457 {@link ProblemDetail}로 변환한다.
 *
 * <pre>{@code
 * {
 *   "type": "https://gotable.dev/errors/reservation_not_found",
 *   "title": "Reservation not found",
 *   "status": 404,
 *   "detail": "Reservation not found",
 *   "code": "RESERVATION_NOT_FOUND"
 * }
 * }</pre>
 *
 * 내부 예외 메시지는 로그에만 남기고 응답에는 포함하지 않는다.
 */
@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final String ERROR_TYPE_BASE = "https://gotable.dev/errors/";

    @ExceptionHandler(BusinessException.class)
    public ResponseEntity<ProblemDetail> handleBusinessException(BusinessException e) {
        log.warn("Business exception: code={}, message={}", e.getErrorCode(), e.getMessage());
        return toResponse(e.getErrorCode(), e.getMessage());
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ProblemDetail> handleValidation(MethodArgumentNotValidException e) {
        String detail = e.getBindingResult().getFieldErrors().stream()
                .map(FieldError::getField)
                .distinct()
                .collect(Collectors.joining(", ", "Invalid fields: ", ""));
        log.warn("Validation failed: {}", detail);
        return toResponse(ErrorCode.INVALID_INPUT, detail);
    }

    @ExceptionHandler({HttpMessageNotReadableException.class, MethodArgumentTypeMismatchException.class})
    public ResponseEntity<ProblemDetail> handleUnreadable(Exception e) {
        log.warn("Malformed request: {}", e.getMessage());
        return toResponse(ErrorCode.INVALID_INPUT, "Malformed request");
    }

    @ExceptionHandler(CallNotPermittedException.class)
    public ResponseEntity<ProblemDetail> handleCircuitBreakerOpen(CallNotPermittedException e) {
        log.warn("Circuit breaker open: {}", e.getMessage());
        return toResponse(ErrorCode.GATEWAY_ERROR, "Payment gateway is temporarily unavailable");
    }

    @ExceptionHandler(DataAccessException.class)
    public ResponseEntity<ProblemDetail> handleDataAccess(DataAccessException e) {
        log.error("Storage failure", e);
        return toResponse(ErrorCode.STORAGE_ERROR, ErrorCode.STORAGE_ERROR.getMessage());
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ProblemDetail> handleException(Exception e) {
        log.error("Unexpected error", e);
        ProblemDetail problem = ProblemDetail.forStatusAndDetail(
                HttpStatus.INTERNAL_SERVER_ERROR, ErrorCode.INTERNAL_ERROR.getMessage());
        problem.setProperty("code", ErrorCode.INTERNAL_ERROR.name());
        return ResponseEntity.internalServerError().body(problem);
    }

    private ResponseEntity<ProblemDetail> toResponse(ErrorCode errorCode, String detail) {
        ProblemDetail problem = ProblemDetail.forStatusAndDetail(errorCode.getStatus(), detail);
        problem.setType(URI.create(ERROR_TYPE_BASE + errorCode.name().toLowerCase()));
        problem.setTitle(errorCode.getMessage());
        problem.setProperty("code", errorCode.name());
        return ResponseEntity.status(errorCode.getStatus()).body(problem);
    }
}
