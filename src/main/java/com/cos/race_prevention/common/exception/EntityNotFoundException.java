package com.cos.race_prevention.common.exception;

/**
 * 요청한 id에 해당하는 행이 없을 때. GlobalExceptionHandler에서 404로 변환
 */
public abstract class EntityNotFoundException extends RuntimeException {

    protected EntityNotFoundException(String message) {
        super(message);
    }
}
