package com.cos.race_prevention.gameshop.dto;

import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * 업그레이드 거절 응답 {"error": "..."}. HTTP 상태는 200
 */
@Getter
@AllArgsConstructor
public class RejectionResponse {

    private final String error;
}
