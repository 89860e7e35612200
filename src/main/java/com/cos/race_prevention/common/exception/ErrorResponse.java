package com.cos.race_prevention.common.exception;

import lombok.Builder;
import lombok.Getter;

import java.time.LocalDateTime;

@Getter
@Builder
public class ErrorResponse {

    private final String error;
    private final int status;
    private final String path;
    private final LocalDateTime timestamp;
}
