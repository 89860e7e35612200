package com.cos.race_prevention.gameshop.dto;

import com.cos.race_prevention.gameshop.entity.Player;
import lombok.AllArgsConstructor;
import lombok.Getter;

@Getter
@AllArgsConstructor
public class PlayerResponse {

    private final String name;
    private final Integer money;
    private final Integer level;

    public static PlayerResponse from(Player player) {
        return new PlayerResponse(player.getName(), player.getMoney(), player.getLevel());
    }
}
