package com.cos.race_prevention.gameshop.controller;

import com.cos.race_prevention.gameshop.dto.PlayerResponse;
import com.cos.race_prevention.gameshop.dto.RejectionResponse;
import com.cos.race_prevention.gameshop.dto.UpgradeResponse;
import com.cos.race_prevention.gameshop.service.UpgradeService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequiredArgsConstructor
public class PlayerController {

    private final UpgradeService upgradeService;

    @GetMapping("/player/{playerId}")
    public PlayerResponse getPlayer(@PathVariable Long playerId) {
        return PlayerResponse.from(upgradeService.getPlayer(playerId));
    }

    /**
     * 성공: {user_id, money, level}
     * 잔액 부족: {error} (둘 다 200)
     */
    @PostMapping("/upgrade/{playerId}")
    public ResponseEntity<?> upgradeLevel(@PathVariable Long playerId) {
        return upgradeService.upgrade(playerId).<ResponseEntity<?>>fold(
                player -> ResponseEntity.ok(UpgradeResponse.from(player)),
                reason -> ResponseEntity.ok(new RejectionResponse(reason))
        );
    }
}
