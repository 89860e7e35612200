package com.cos.race_prevention.gameshop.dto;

import com.cos.race_prevention.gameshop.entity.Player;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Getter;

@Getter
@AllArgsConstructor
public class UpgradeResponse {

    @JsonProperty("user_id")
    private final Long userId;
    private final Integer money;
    private final Integer level;

    public static UpgradeResponse from(Player player) {
        return new UpgradeResponse(player.getId(), player.getMoney(), player.getLevel());
    }
}
