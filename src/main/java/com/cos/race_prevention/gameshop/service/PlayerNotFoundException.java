package com.cos.race_prevention.gameshop.service;

import com.cos.race_prevention.common.exception.EntityNotFoundException;

public class PlayerNotFoundException extends EntityNotFoundException {

    public PlayerNotFoundException(Long playerId) {
        super("플레이어를 찾을 수 없습니다: " + playerId);
    }
}
