package com.cos.race_prevention.common.exception;

import jakarta.servlet.http.HttpServletRequest;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.http.HttpStatus;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.time.LocalDateTime;

/**
 * 예외 -> HTTP 응답 변환
 *
 * - 행 없음: 404
 * - 잘못된 id 형식: 400
 * - DB 오류 (연결 실패, 잔액 조건과 무관한 제약 위반 등) 및 그 외 예외: 500
 *
 * 잔액 부족은 예외가 아니므로 여기로 오지 않음 (UpgradeResult.rejected)
 */
@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    @ExceptionHandler(EntityNotFoundException.class)
    public ResponseEntity<ErrorResponse> handleNotFound(EntityNotFoundException ex, HttpServletRequest request) {
        log.warn("Not found: {}", ex.getMessage());
        return build(HttpStatus.NOT_FOUND, ex.getMessage(), request);
    }

    @ExceptionHandler(MethodArgumentTypeMismatchException.class)
    public ResponseEntity<ErrorResponse> handleTypeMismatch(MethodArgumentTypeMismatchException ex,
                                                            HttpServletRequest request) {
        log.warn("Invalid path variable {}: {}", ex.getName(), ex.getValue());
        return build(HttpStatus.BAD_REQUEST, "Invalid " + ex.getName() + ": " + ex.getValue(), request);
    }

    @ExceptionHandler(DataAccessException.class)
    public ResponseEntity<ErrorResponse> handleDataAccess(DataAccessException ex, HttpServletRequest request) {
        log.error("Store failure on {}", request.getRequestURI(), ex);
        return build(HttpStatus.INTERNAL_SERVER_ERROR, "Internal server error", request);
    }

    /**
     * DB 연결 실패(CannotCreateTransactionException) 등 위에서 처리하지 않은 모든 예외.
     * 없는 경로, 허용되지 않는 메서드 같은 Spring MVC 예외는 원래 상태 코드 유지
     */
    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleUnexpected(Exception ex, HttpServletRequest request) {
        if (ex instanceof org.springframework.web.ErrorResponse mvcError) {
            log.warn("Request rejected on {}: {}", request.getRequestURI(), ex.getMessage());
            return build(mvcError.getStatusCode(), ex.getMessage(), request);
        }
        log.error("Unexpected error on {}", request.getRequestURI(), ex);
        return build(HttpStatus.INTERNAL_SERVER_ERROR, "Internal server error", request);
    }

    private ResponseEntity<ErrorResponse> build(HttpStatusCode status, String message, HttpServletRequest request) {
        ErrorResponse body = ErrorResponse.builder()
                .error(message)
                .status(status.value())
                .path(request.getRequestURI())
                .timestamp(LocalDateTime.now())
                .build();
        return ResponseEntity.status(status).body(body);
    }
}
