package com.cos.race_prevention.gameshop.config;

import jakarta.validation.constraints.Positive;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * game-shop.* 설정
 */
@Getter
@Setter
@Validated
@ConfigurationProperties(prefix = "game-shop")
public class GameShopProperties {

    /**
     * 레벨업 1회 비용. 0 이하면 조건부 차감(money >= cost)이 의미 없어지므로 양수만 허용
     */
    @Positive
    private int upgradeCost = 150;
}
